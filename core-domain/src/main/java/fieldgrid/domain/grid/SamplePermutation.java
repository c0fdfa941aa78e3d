package fieldgrid.domain.grid;

import fieldgrid.domain.exception.ShapeMismatchException;

import java.util.Objects;

/**
 * Biyección N -> N producida al ordenar las coordenadas.
 * <p>
 * {@code sourceIndex(k)} es el índice original de la muestra que queda en la posición
 * {@code k} tras ordenar. Aplicar la misma permutación a los puntos y a cada canal
 * preserva la correspondencia muestra a muestra.
 */
public final class SamplePermutation {

    private final int[] order;

    private SamplePermutation(int[] order) {
        this.order = order;
    }

    /**
     * Construye la permutación validando que cada índice aparece exactamente una vez.
     */
    public static SamplePermutation of(int[] order) {
        Objects.requireNonNull(order, "El orden no puede ser nulo.");
        boolean[] seen = new boolean[order.length];
        for (int k = 0; k < order.length; k++) {
            int idx = order[k];
            if (idx < 0 || idx >= order.length || seen[idx]) {
                throw new IllegalArgumentException("No es una permutación válida: índice " + idx + " en la posición " + k);
            }
            seen[idx] = true;
        }
        return new SamplePermutation(order.clone());
    }

    public static SamplePermutation identity(int size) {
        int[] order = new int[size];
        for (int i = 0; i < size; i++) {
            order[i] = i;
        }
        return new SamplePermutation(order);
    }

    public int size() {
        return order.length;
    }

    public int sourceIndex(int sortedPosition) {
        return order[sortedPosition];
    }

    /**
     * Reordena un canal crudo al orden de rejilla.
     *
     * @throws ShapeMismatchException si el canal no tiene una muestra por punto.
     */
    public double[] apply(double[] rawValues) {
        Objects.requireNonNull(rawValues, "Los valores del canal no pueden ser nulos.");
        if (rawValues.length != order.length) {
            throw new ShapeMismatchException("El canal tiene " + rawValues.length
                    + " valores pero la permutación cubre " + order.length + " muestras.",
                    order.length, rawValues.length);
        }
        double[] sorted = new double[order.length];
        for (int k = 0; k < order.length; k++) {
            sorted[k] = rawValues[order[k]];
        }
        return sorted;
    }

    public int[] toArray() {
        return order.clone();
    }
}
