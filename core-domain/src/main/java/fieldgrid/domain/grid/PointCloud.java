package fieldgrid.domain.grid;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fieldgrid.domain.field.Axis;

import java.util.Arrays;
import java.util.Objects;

/**
 * Lista inmutable de N coordenadas 3D, una por muestra.
 * <p>
 * ALMACENAMIENTO: un único array primitivo empaquetado.
 * <p>
 * Layout: [x0, y0, z0 | x1, y1, z1 | ... ]. Tamaño total = 3 * N.
 * <p>
 * Semánticamente no se asume ningún orden de entrada.
 */
public final class PointCloud {

    public static final int DIMENSIONS = 3;

    private final double[] packed;

    private PointCloud(double[] packed) {
        this.packed = packed;
    }

    /**
     * Crea una nube a partir de un array plano [x0,y0,z0,x1,...]. Copia defensiva.
     */
    public static PointCloud ofPacked(double[] packed) {
        Objects.requireNonNull(packed, "El array de coordenadas no puede ser nulo.");
        if (packed.length % DIMENSIONS != 0) {
            throw new IllegalArgumentException("El array empaquetado debe tener longitud múltiplo de 3, recibido: " + packed.length);
        }
        return new PointCloud(normalizeZeros(packed.clone()));
    }

    /**
     * Crea una nube a partir de filas (x, y, z). Copia defensiva.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PointCloud of(double[][] points) {
        Objects.requireNonNull(points, "La lista de puntos no puede ser nula.");
        double[] packed = new double[points.length * DIMENSIONS];
        for (int i = 0; i < points.length; i++) {
            double[] p = points[i];
            if (p == null || p.length != DIMENSIONS) {
                throw new IllegalArgumentException("El punto " + i + " debe tener exactamente 3 componentes.");
            }
            System.arraycopy(p, 0, packed, i * DIMENSIONS, DIMENSIONS);
        }
        return new PointCloud(normalizeZeros(packed));
    }

    // -0.0 y 0.0 son la misma coordenada: se guarda siempre +0.0 para que ordenación e igualdad coincidan.
    private static double[] normalizeZeros(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == 0.0) {
                values[i] = 0.0;
            }
        }
        return values;
    }

    public int size() {
        return packed.length / DIMENSIONS;
    }

    public boolean isEmpty() {
        return packed.length == 0;
    }

    public double x(int i) {
        return packed[i * DIMENSIONS];
    }

    public double y(int i) {
        return packed[i * DIMENSIONS + 1];
    }

    public double z(int i) {
        return packed[i * DIMENSIONS + 2];
    }

    public double coordinate(int i, Axis axis) {
        return packed[i * DIMENSIONS + axis.index()];
    }

    /**
     * Columna de un eje (p.ej. todas las x) en el orden actual de la nube.
     */
    public double[] axisValues(Axis axis) {
        int n = size();
        double[] column = new double[n];
        for (int i = 0; i < n; i++) {
            column[i] = coordinate(i, axis);
        }
        return column;
    }

    /**
     * Devuelve una nueva nube con las muestras reordenadas por la permutación.
     */
    public PointCloud permute(SamplePermutation permutation) {
        int n = size();
        if (permutation.size() != n) {
            throw new IllegalArgumentException("La permutación (" + permutation.size()
                    + ") no coincide con el número de puntos (" + n + ").");
        }
        double[] result = new double[packed.length];
        for (int k = 0; k < n; k++) {
            System.arraycopy(packed, permutation.sourceIndex(k) * DIMENSIONS, result, k * DIMENSIONS, DIMENSIONS);
        }
        return new PointCloud(result);
    }

    /**
     * Copia del array plano interno.
     */
    public double[] toPacked() {
        return packed.clone();
    }

    @JsonValue
    public double[][] toArray() {
        int n = size();
        double[][] rows = new double[n][];
        for (int i = 0; i < n; i++) {
            rows[i] = Arrays.copyOfRange(packed, i * DIMENSIONS, (i + 1) * DIMENSIONS);
        }
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(packed, ((PointCloud) o).packed);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(packed);
    }

    @Override
    public String toString() {
        return "PointCloud[n=" + size() + "]";
    }
}
