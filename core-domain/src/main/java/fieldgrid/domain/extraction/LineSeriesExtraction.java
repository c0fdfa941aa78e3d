package fieldgrid.domain.extraction;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Serie temporal de extracciones 1D.
 * <p>
 * No asume geometría fija: cada frame puede tener un número distinto de muestras.
 */
@Value
public class LineSeriesExtraction implements IExtractionResult {

    List<Double> times;

    List<LineExtraction> frames;

    List<String> channels;

    @Builder
    public LineSeriesExtraction(List<Double> times, List<LineExtraction> frames, List<String> channels) {
        Objects.requireNonNull(times, "Los instantes no pueden ser nulos.");
        Objects.requireNonNull(frames, "Los frames no pueden ser nulos.");
        Objects.requireNonNull(channels, "Los canales no pueden ser nulos.");
        if (times.size() != frames.size()) {
            throw new IllegalArgumentException("Hay " + times.size() + " instantes pero " + frames.size() + " frames.");
        }
        this.times = List.copyOf(times);
        this.frames = List.copyOf(frames);
        this.channels = List.copyOf(channels);
    }

    public int getFrameCount() {
        return frames.size();
    }

    public double[] coordinatesAt(int timeIndex) {
        return frames.get(timeIndex).getCoordinates();
    }

    public double[][] dataAt(int timeIndex) {
        return frames.get(timeIndex).getData().toMatrix();
    }
}
