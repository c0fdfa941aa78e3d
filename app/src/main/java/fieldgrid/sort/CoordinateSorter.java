package fieldgrid.sort;

import fieldgrid.domain.grid.PointCloud;
import fieldgrid.domain.grid.SamplePermutation;
import fieldgrid.domain.grid.SortedPoints;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Objects;

/**
 * Ordena una lista de puntos en orden lexicográfico (x, y, z).
 * <p>
 * X es la clave dominante (eje de variación más lenta) y Z la menos significativa (eje de
 * variación más rápida), que es justo el layout que necesita un reshape row-major.
 * <p>
 * Los empates exactos se resuelven por el índice original, de modo que el orden es total,
 * estable y reproducible incluso con coordenadas duplicadas.
 */
@Slf4j
public class CoordinateSorter {

    public SortedPoints sort(PointCloud points) {
        Objects.requireNonNull(points, "La lista de puntos no puede ser nula.");
        int n = points.size();

        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        // Arrays.sort sobre objetos es un merge sort estable; el índice como última clave lo hace además total.
        Arrays.sort(order, (a, b) -> compare(points, a, b));

        int[] primitive = new int[n];
        for (int k = 0; k < n; k++) {
            primitive[k] = order[k];
        }
        SamplePermutation permutation = SamplePermutation.of(primitive);
        log.debug("Ordenados {} puntos por (x, y, z).", n);
        return new SortedPoints(permutation, points.permute(permutation));
    }

    private static int compare(PointCloud p, int a, int b) {
        int c = Double.compare(p.x(a), p.x(b));
        if (c != 0) return c;
        c = Double.compare(p.y(a), p.y(b));
        if (c != 0) return c;
        c = Double.compare(p.z(a), p.z(b));
        if (c != 0) return c;
        return Integer.compare(a, b);
    }
}
