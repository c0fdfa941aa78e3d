package fieldgrid.pipeline;

import fieldgrid.config.ExtractionConfig;
import fieldgrid.domain.extraction.LineExtraction;
import fieldgrid.domain.field.Axis;
import fieldgrid.domain.field.FieldRef;
import fieldgrid.domain.source.IDataSource;
import fieldgrid.source.InMemoryDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FramePipelineTest {

    private final IDataSource source = InMemoryDataSource.of(
            new double[][]{{2, 5, 0}, {0, 7, 0}, {1, 6, 0}},
            Map.of("f", new double[]{20, 0, 10}));

    @Test
    @DisplayName("sortAndRead: Puntos y canales deben compartir la misma permutación")
    void sortAndRead_shouldApplySamePermutation() {
        FramePipeline pipeline = new FramePipeline(ExtractionConfig.defaults());

        SortedFrame frame = pipeline.sortAndRead(source, List.of(FieldRef.scalar("f")));

        assertArrayEquals(new int[]{1, 2, 0}, frame.sorted().permutation().toArray());
        assertArrayEquals(new double[]{0, 10, 20}, frame.channels()[0]);
        assertEquals(3, frame.size());
    }

    @Test
    @DisplayName("toLine: El eje configurado determina las coordenadas devueltas, no el orden")
    void toLine_withYAxis_shouldReturnYCoordinatesInSortedOrder() {
        FramePipeline pipeline = new FramePipeline(ExtractionConfig.defaults().withLineAxis(Axis.Y));
        SortedFrame frame = pipeline.sortAndRead(source, List.of(FieldRef.scalar("f")));

        LineExtraction line = pipeline.toLine(frame, List.of("f"));

        // El orden sigue siendo (x, y, z); solo cambia la columna devuelta
        assertArrayEquals(new double[]{7, 6, 5}, line.getCoordinates());
        assertArrayEquals(new double[]{0, 10, 20}, line.getChannel("f"));
    }

    @Test
    @DisplayName("toLine: Un rango que excluye todo produce una línea vacía, no un error")
    void toLine_withEmptyRange_shouldReturnEmptyLine() {
        FramePipeline pipeline = new FramePipeline(ExtractionConfig.builder().lineMin(10.0).build());
        SortedFrame frame = pipeline.sortAndRead(source, List.of(FieldRef.scalar("f")));

        LineExtraction line = pipeline.toLine(frame, List.of("f"));

        assertEquals(0, line.getSampleCount());
        assertArrayEquals(new int[]{1, 0}, line.getData().shape());
    }
}
