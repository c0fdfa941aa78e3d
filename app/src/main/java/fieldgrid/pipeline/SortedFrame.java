package fieldgrid.pipeline;

import fieldgrid.domain.grid.SortedPoints;

/**
 * Un frame ya ordenado: puntos en orden (x, y, z) y los canales reordenados con la misma
 * permutación, forma (canales, N).
 *
 * @param sorted   Puntos ordenados y permutación aplicada.
 * @param channels Valores de cada canal en el orden de {@code sorted}.
 */
public record SortedFrame(SortedPoints sorted, double[][] channels) {

    public int size() {
        return sorted.size();
    }
}
