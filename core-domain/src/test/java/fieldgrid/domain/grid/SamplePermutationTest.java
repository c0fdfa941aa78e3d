package fieldgrid.domain.grid;

import fieldgrid.domain.exception.ShapeMismatchException;
import fieldgrid.domain.field.Axis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SamplePermutationTest {

    @Test
    @DisplayName("Correspondencia: La misma permutación sobre puntos y canal debe mantener cada valor con su punto")
    void apply_shouldPreserveSampleCorrespondence() {
        // ARRANGE: el valor de cada muestra es su coordenada x * 10
        PointCloud points = PointCloud.of(new double[][]{{2, 0, 0}, {0, 0, 0}, {1, 0, 0}});
        double[] values = {20, 0, 10};
        SamplePermutation permutation = SamplePermutation.of(new int[]{1, 2, 0});

        // ACT
        PointCloud sortedPoints = points.permute(permutation);
        double[] sortedValues = permutation.apply(values);

        // ASSERT
        for (int k = 0; k < sortedPoints.size(); k++) {
            assertEquals(sortedPoints.coordinate(k, Axis.X) * 10, sortedValues[k], 1e-12);
        }
    }

    @Test
    @DisplayName("Validación: Un índice repetido o fuera de rango no es una permutación")
    void of_withInvalidOrder_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> SamplePermutation.of(new int[]{0, 0, 1}));
        assertThrows(IllegalArgumentException.class, () -> SamplePermutation.of(new int[]{0, 3, 1}));
    }

    @Test
    @DisplayName("apply: Un canal con otra longitud debe producir ShapeMismatchException")
    void apply_withWrongLength_shouldThrow() {
        SamplePermutation identity = SamplePermutation.identity(3);

        assertThrows(ShapeMismatchException.class, () -> identity.apply(new double[4]));
    }

    @Test
    @DisplayName("PointCloud: Debe rechazar puntos que no tengan 3 componentes")
    void pointCloud_withWrongArity_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> PointCloud.of(new double[][]{{0, 0}}));
        assertThrows(IllegalArgumentException.class, () -> PointCloud.ofPacked(new double[]{0, 0, 0, 1}));
    }
}
