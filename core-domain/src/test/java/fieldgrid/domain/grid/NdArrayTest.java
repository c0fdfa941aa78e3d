package fieldgrid.domain.grid;

import fieldgrid.domain.exception.ShapeMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test unitario para {@link NdArray}.
 * <p>
 * Verifica la aritmética row-major (último eje = variación más rápida) y que las
 * discrepancias de tamaño fallan en lugar de truncar o rellenar.
 */
class NdArrayTest {

    @Test
    @DisplayName("Indexado row-major: El último índice debe ser el de variación más rápida")
    void get_shouldUseRowMajorLayout() {
        // ARRANGE: forma (2, 3) con valores 0..5
        NdArray array = NdArray.of(new int[]{2, 3}, new double[]{0, 1, 2, 3, 4, 5});

        // ASSERT
        assertEquals(0.0, array.get(0, 0));
        assertEquals(2.0, array.get(0, 2));
        assertEquals(3.0, array.get(1, 0));
        assertEquals(5.0, array.get(1, 2));
    }

    @Test
    @DisplayName("Forma incompatible: 10 valores no caben en (3, 3)")
    void of_withMismatchedCount_shouldThrowShapeMismatch() {
        ShapeMismatchException ex = assertThrows(ShapeMismatchException.class,
                () -> NdArray.of(new int[]{3, 3}, new double[10]));

        assertEquals(9, ex.getExpectedCount());
        assertEquals(10, ex.getActualCount());
        assertTrue(ex.getTimeIndex().isEmpty());
    }

    @Test
    @DisplayName("reshape: Debe conservar el orden plano y fallar si cambia el número de celdas")
    void reshape_shouldKeepFlatOrder() {
        NdArray array = NdArray.of(new int[]{6}, new double[]{1, 2, 3, 4, 5, 6});

        NdArray reshaped = array.reshape(3, 2);

        assertArrayEquals(new int[]{3, 2}, reshaped.shape());
        assertEquals(4.0, reshaped.get(1, 1));
        assertThrows(ShapeMismatchException.class, () -> array.reshape(4, 2));
    }

    @Test
    @DisplayName("slice: Debe extraer el sub-array del primer eje como copia")
    void slice_shouldReturnSubArray() {
        NdArray array = NdArray.of(new int[]{2, 2, 2}, new double[]{1, 2, 3, 4, 5, 6, 7, 8});

        NdArray second = array.slice(1);

        assertArrayEquals(new int[]{2, 2}, second.shape());
        assertArrayEquals(new double[]{5, 6, 7, 8}, second.flatten());
        assertThrows(IndexOutOfBoundsException.class, () -> array.slice(2));
    }

    @Test
    @DisplayName("Inmutabilidad: Modificar el array de entrada o de salida no altera el NdArray")
    void of_shouldCopyDefensively() {
        double[] data = {1, 2, 3};
        NdArray array = NdArray.of(new int[]{3}, data);

        data[0] = 99;
        array.flatten()[1] = 99;

        assertThat(array.flatten()).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("toMatrix: Un array de rango 2 debe convertirse en filas")
    void toMatrix_shouldSplitRows() {
        NdArray array = NdArray.of(new int[]{1, 3}, new double[]{10, 20, 30});

        double[][] rows = array.toMatrix();

        assertEquals(1, rows.length);
        assertArrayEquals(new double[]{10, 20, 30}, rows[0]);
    }
}
