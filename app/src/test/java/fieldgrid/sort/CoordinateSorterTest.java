package fieldgrid.sort;

import fieldgrid.domain.grid.PointCloud;
import fieldgrid.domain.grid.SortedPoints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Test unitario para {@link CoordinateSorter}.
 * <p>
 * Verifica el orden lexicográfico (x, y, z), la idempotencia y la estabilidad con empates.
 */
class CoordinateSorterTest {

    private CoordinateSorter sorter;

    @BeforeEach
    void setUp() {
        sorter = new CoordinateSorter();
    }

    @Test
    @DisplayName("Orden lexicográfico: X domina sobre Y, e Y sobre Z")
    void sort_shouldOrderByXThenYThenZ() {
        // ARRANGE
        PointCloud points = PointCloud.of(new double[][]{
                {1, 0, 0},
                {0, 1, 0},
                {0, 0, 1},
                {0, 0, 0},
                {1, -1, 5}
        });

        // ACT
        SortedPoints sorted = sorter.sort(points);

        // ASSERT
        assertThat(sorted.points().toArray()).isDeepEqualTo(new double[][]{
                {0, 0, 0},
                {0, 0, 1},
                {0, 1, 0},
                {1, -1, 5},
                {1, 0, 0}
        });
        assertArrayEquals(new int[]{3, 2, 1, 4, 0}, sorted.permutation().toArray());
    }

    @Test
    @DisplayName("Idempotencia: Ordenar una lista ya ordenada no la cambia")
    void sort_shouldBeIdempotent() {
        // ARRANGE: nube pseudoaleatoria reproducible con muchas coordenadas repetidas
        Random random = new Random(42L);
        double[][] raw = new double[200][3];
        for (double[] p : raw) {
            p[0] = random.nextInt(5);
            p[1] = random.nextInt(5);
            p[2] = random.nextInt(5);
        }

        // ACT
        SortedPoints once = sorter.sort(PointCloud.of(raw));
        SortedPoints twice = sorter.sort(once.points());

        // ASSERT
        assertEquals(once.points(), twice.points());
        int[] identity = new int[raw.length];
        for (int i = 0; i < identity.length; i++) identity[i] = i;
        assertArrayEquals(identity, twice.permutation().toArray(), "Sobre datos ordenados la permutación debe ser la identidad");
    }

    @Test
    @DisplayName("Estabilidad: Los duplicados exactos conservan su orden original")
    void sort_withExactTies_shouldBeStable() {
        // ARRANGE: índices 0, 2 y 3 son el mismo punto
        PointCloud points = PointCloud.of(new double[][]{
                {1, 1, 1},
                {0, 0, 0},
                {1, 1, 1},
                {1, 1, 1}
        });

        // ACT
        SortedPoints sorted = sorter.sort(points);

        // ASSERT
        assertArrayEquals(new int[]{1, 0, 2, 3}, sorted.permutation().toArray());
    }

    @Test
    @DisplayName("Lista vacía: El orden es trivial y no falla")
    void sort_emptyList_shouldReturnEmpty() {
        SortedPoints sorted = sorter.sort(PointCloud.of(new double[0][]));

        assertEquals(0, sorted.size());
    }
}
