package fieldgrid.domain.grid;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import fieldgrid.domain.exception.ShapeMismatchException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Array N-dimensional denso de {@code double} en orden row-major.
 * <p>
 * ALMACENAMIENTO: array plano + forma. El último eje es el de variación más rápida:
 * offset(i0, i1, ..., ik) = ((i0 * s1 + i1) * s2 + ...) + ik.
 * <p>
 * Cada extracción crea arrays nuevos; el llamador es su único propietario.
 */
public final class NdArray {

    private final int[] shape;
    private final int[] strides;
    private final double[] data;

    private NdArray(int[] shape, double[] data) {
        long expected = count(shape);
        if (expected != data.length) {
            throw new ShapeMismatchException("No se pueden colocar " + data.length + " valores en la forma "
                    + Arrays.toString(shape) + " (" + expected + " celdas).", expected, data.length);
        }
        this.shape = shape;
        this.data = data;
        this.strides = computeStrides(shape);
    }

    /**
     * Crea un array copiando los datos.
     */
    @JsonCreator
    public static NdArray of(@JsonProperty("shape") int[] shape, @JsonProperty("data") double[] data) {
        Objects.requireNonNull(shape, "La forma no puede ser nula.");
        Objects.requireNonNull(data, "Los datos no pueden ser nulos.");
        return new NdArray(validShape(shape), data.clone());
    }

    /**
     * Crea un array SIN copiar los datos: el llamador cede la propiedad del buffer.
     * Uso interno de los pasos de remodelado, que ya trabajan sobre buffers recién creados.
     */
    public static NdArray adopt(double[] data, int... shape) {
        Objects.requireNonNull(data, "Los datos no pueden ser nulos.");
        return new NdArray(validShape(shape), data);
    }

    @JsonProperty("shape")
    public int[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    public int dim(int axis) {
        return shape[axis];
    }

    public int size() {
        return data.length;
    }

    public double get(int... index) {
        return data[offset(index)];
    }

    /**
     * Sub-array obtenido fijando el primer eje (p.ej. un canal o un instante). Copia.
     */
    public NdArray slice(int first) {
        if (shape.length < 2) {
            throw new IllegalStateException("No se puede trocear un array de rango " + shape.length + ".");
        }
        if (first < 0 || first >= shape[0]) {
            throw new IndexOutOfBoundsException("Índice " + first + " fuera de los límites [0, " + (shape[0] - 1) + "].");
        }
        int[] rest = Arrays.copyOfRange(shape, 1, shape.length);
        int len = strides[0];
        double[] part = new double[len];
        System.arraycopy(data, first * len, part, 0, len);
        return new NdArray(rest, part);
    }

    /**
     * Nueva vista con otra forma sobre una copia de los datos.
     *
     * @throws ShapeMismatchException si el número de celdas no coincide (nunca trunca ni rellena).
     */
    public NdArray reshape(int... newShape) {
        return new NdArray(validShape(newShape), data.clone());
    }

    /**
     * Copia plana en orden row-major.
     */
    @JsonProperty("data")
    public double[] flatten() {
        return data.clone();
    }

    /**
     * Conversión de un array de rango 2 a matriz Java (filas = primer eje).
     */
    public double[][] toMatrix() {
        if (shape.length != 2) {
            throw new IllegalStateException("toMatrix() solo aplica a arrays de rango 2, rango actual: " + shape.length);
        }
        double[][] rows = new double[shape[0]][];
        for (int i = 0; i < shape[0]; i++) {
            rows[i] = Arrays.copyOfRange(data, i * shape[1], (i + 1) * shape[1]);
        }
        return rows;
    }

    private int offset(int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Se esperaban " + shape.length + " índices, recibidos " + index.length);
        }
        int off = 0;
        for (int a = 0; a < index.length; a++) {
            if (index[a] < 0 || index[a] >= shape[a]) {
                throw new IndexOutOfBoundsException("Índice " + index[a] + " fuera de los límites del eje " + a
                        + " [0, " + (shape[a] - 1) + "].");
            }
            off += index[a] * strides[a];
        }
        return off;
    }

    private static int[] validShape(int[] shape) {
        if (shape == null || shape.length == 0) {
            throw new IllegalArgumentException("La forma debe tener al menos un eje.");
        }
        for (int d : shape) {
            if (d < 0) {
                throw new IllegalArgumentException("Extensión negativa en la forma " + Arrays.toString(shape));
            }
        }
        return shape.clone();
    }

    private static long count(int[] shape) {
        long c = 1L;
        for (int d : shape) {
            c *= d;
        }
        return c;
    }

    private static int[] computeStrides(int[] shape) {
        int[] s = new int[shape.length];
        int acc = 1;
        for (int a = shape.length - 1; a >= 0; a--) {
            s[a] = acc;
            acc *= shape[a];
        }
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NdArray that = (NdArray) o;
        return Arrays.equals(shape, that.shape) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "NdArray" + Arrays.toString(shape);
    }
}
