package fieldgrid.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fieldgrid.domain.extraction.GridExtraction;
import fieldgrid.domain.extraction.GridSeriesExtraction;
import fieldgrid.extractor.GridExtractor;
import fieldgrid.source.TimeSeriesDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Pruebas unitarias para {@link ExtractionJsonCodec}.
 */
class ExtractionJsonCodecTest {

    private static final String TWO_FRAMES = """
            {
              "frames": [
                { "time": 0.0,
                  "points": [[1, 0, 0], [0, 0, 0], [1, 1, 0], [0, 1, 0]],
                  "scalars": { "rho": [3, 1, 4, 2] },
                  "vectors": { "E": [[3, 0, 0], [1, 0, 0], [4, 0, 0], [2, 0, 0]] } },
                { "time": 0.5,
                  "points": [[0, 0, 0], [0, 1, 0], [1, 0, 0], [1, 1, 0]],
                  "scalars": { "rho": [5, 6, 7, 8] },
                  "vectors": { "E": [[5, 0, 0], [6, 0, 0], [7, 0, 0], [8, 0, 0]] } }
              ]
            }
            """;

    private ExtractionJsonCodec codec;

    @BeforeEach
    void setUp() {
        codec = new ExtractionJsonCodec();
    }

    @Test
    @DisplayName("Debería construir una fuente temporal a partir de la descripción JSON de frames")
    void readFrames_shouldBuildTimeSeriesSource() throws IOException {
        // --- Arrange & Act ---
        TimeSeriesDataSource source = codec.readFrames(TWO_FRAMES);

        // --- Assert ---
        assertThat(source.getTimeValues()).containsExactly(0.0, 0.5);
        assertThat(source.getPoints().size()).isEqualTo(4);
        assertThat(source.atTime(0.5).findScalarField("rho")).hasValueSatisfying(
                values -> assertThat(values).containsExactly(5, 6, 7, 8));
    }

    @Test
    @DisplayName("Debería extraer la serie 2D de una fuente leída desde JSON")
    void readFrames_thenExtract_shouldStackFrames() throws IOException {
        TimeSeriesDataSource source = codec.readFrames(new StringReader(TWO_FRAMES));

        GridSeriesExtraction series = new GridExtractor().extractGrid2dSeries(source, List.of("rho", "E_X"));

        assertThat(series.getData().shape()).containsExactly(2, 2, 2, 2);
        assertThat(series.frameAt(0).getChannel("rho").flatten()).containsExactly(1, 2, 3, 4);
        assertThat(series.frameAt(0).getChannel("E_X").flatten()).containsExactly(1, 2, 3, 4);
        assertThat(series.frameAt(1).getChannel("rho").flatten()).containsExactly(5, 6, 7, 8);
    }

    @Test
    @DisplayName("Debería serializar una extracción con forma, canales y datos planos")
    void toJson_shouldWriteShapeChannelsAndData() throws IOException {
        // --- Arrange ---
        TimeSeriesDataSource source = codec.readFrames(TWO_FRAMES);
        GridExtraction grid = new GridExtractor().extractGrid2d(source, List.of("rho"));

        // --- Act ---
        String json = codec.toJson(grid);

        // --- Assert ---
        JsonNode node = new ObjectMapper().readTree(json);
        assertThat(node.get("shape").toString()).isEqualTo("[2,2]");
        assertThat(node.get("channels").get(0).asText()).isEqualTo("rho");
        assertThat(node.get("data").get("shape").toString()).isEqualTo("[1,2,2]");
        assertThat(node.get("data").get("data").toString()).isEqualTo("[1.0,2.0,3.0,4.0]");
        assertThat(node.get("points").get("shape").toString()).isEqualTo("[2,2,3]");
    }

    @Test
    @DisplayName("Debería escribir en un Writer proporcionado por el llamador")
    void write_shouldUseCallerWriter() throws IOException {
        TimeSeriesDataSource source = codec.readFrames(TWO_FRAMES);
        StringWriter writer = new StringWriter();

        codec.write(new GridExtractor().extractLine(source, List.of("rho")), writer);

        assertThat(writer.toString()).contains("\"coordinates\"").contains("\"channels\"");
    }

    @Test
    @DisplayName("Debería lanzar IOException con un JSON mal formado o sin frames")
    void readFrames_invalidDocument_shouldThrow() {
        assertThrows(IOException.class, () -> codec.readFrames("{ \"frames\": [ }"));
        assertThrows(IOException.class, () -> codec.readFrames("{ \"frames\": [] }"));
        assertThrows(IOException.class, () -> codec.readFrames("{ \"frames\": [ { \"time\": 0.0 } ] }"));
    }
}
