package fieldgrid.source;

import fieldgrid.domain.grid.PointCloud;
import fieldgrid.domain.source.IDataSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Fuente de datos con varios instantes declarados, cada uno con su instantánea.
 * <p>
 * La reevaluación en un instante t selecciona el frame declarado más reciente con tiempo
 * {@code <= t} (o el primero si t es anterior a todos), igual que un lector que ajusta el
 * tiempo pedido al paso de tiempo disponible. La propia instancia representa el primer frame.
 */
@Slf4j
public final class TimeSeriesDataSource implements IDataSource {

    private final NavigableMap<Double, IDataSource> frames;
    private final IDataSource current;

    private TimeSeriesDataSource(NavigableMap<Double, IDataSource> frames, IDataSource current) {
        this.frames = frames;
        this.current = current;
    }

    /**
     * @param frames Instantánea por instante. No puede estar vacío.
     */
    public static TimeSeriesDataSource of(Map<Double, ? extends IDataSource> frames) {
        Objects.requireNonNull(frames, "El mapa de frames no puede ser nulo.");
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("Una serie temporal necesita al menos un frame.");
        }
        NavigableMap<Double, IDataSource> sorted = new TreeMap<>();
        frames.forEach((t, f) -> sorted.put(
                Objects.requireNonNull(t, "Instante nulo."),
                Objects.requireNonNull(f, "Frame nulo en t=" + t)));
        return new TimeSeriesDataSource(sorted, sorted.firstEntry().getValue());
    }

    @Override
    public PointCloud getPoints() {
        return current.getPoints();
    }

    @Override
    public Optional<double[]> findScalarField(String name) {
        return current.findScalarField(name);
    }

    @Override
    public Optional<double[][]> findVectorField(String name) {
        return current.findVectorField(name);
    }

    @Override
    public List<Double> getTimeValues() {
        return List.copyOf(new ArrayList<>(frames.keySet()));
    }

    @Override
    public IDataSource atTime(double time) {
        Map.Entry<Double, IDataSource> entry = frames.floorEntry(time);
        if (entry == null) {
            entry = frames.firstEntry();
        }
        if (Double.compare(entry.getKey(), time) != 0) {
            log.debug("Instante t={} no declarado, se usa el frame de t={}.", time, entry.getKey());
        }
        return new TimeSeriesDataSource(frames, entry.getValue());
    }
}
