package fieldgrid.domain.grid;

import java.util.Objects;

/**
 * Resultado del ordenador de coordenadas: la permutación y los puntos ya reordenados.
 *
 * @param permutation Permutación aplicada (posición ordenada -> índice original).
 * @param points      Puntos en orden lexicográfico (x, y, z).
 */
public record SortedPoints(SamplePermutation permutation, PointCloud points) {

    public SortedPoints {
        Objects.requireNonNull(permutation, "La permutación no puede ser nula.");
        Objects.requireNonNull(points, "Los puntos no pueden ser nulos.");
        if (permutation.size() != points.size()) {
            throw new IllegalArgumentException("La permutación y los puntos deben cubrir el mismo número de muestras.");
        }
    }

    public int size() {
        return points.size();
    }
}
