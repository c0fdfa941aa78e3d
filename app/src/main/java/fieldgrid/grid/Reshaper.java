package fieldgrid.grid;

import fieldgrid.domain.exception.ShapeMismatchException;
import fieldgrid.domain.grid.GridShape;
import fieldgrid.domain.grid.NdArray;
import fieldgrid.domain.grid.PointCloud;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Coloca canales ya ordenados en arrays densos row-major.
 * <p>
 * El orden de ejes (x, y, z), de variación lenta a rápida, es el mismo que el de las claves
 * de ordenación, por lo que el remodelado es una simple copia contigua por canal.
 * Nunca trunca ni rellena: cualquier discrepancia de tamaño es un {@link ShapeMismatchException}.
 */
public class Reshaper {

    /**
     * @param channels Valores ordenados, forma (canales, N).
     * @param shape    Forma de la rejilla.
     * @return Array con forma (canales, size_x[, size_y[, size_z]]).
     */
    public NdArray reshape(double[][] channels, GridShape shape) {
        Objects.requireNonNull(channels, "Los canales no pueden ser nulos.");
        Objects.requireNonNull(shape, "La forma no puede ser nula.");

        long cells = shape.elementCount();
        int cellCount = checkedCellCount(shape);
        double[] packed = new double[Math.multiplyExact(channels.length, cellCount)];
        for (int c = 0; c < channels.length; c++) {
            double[] values = Objects.requireNonNull(channels[c], "El canal " + c + " es nulo.");
            if (values.length != cells) {
                throw new ShapeMismatchException("No se pueden remodelar " + values.length + " muestras en "
                        + shape + " (" + cells + " celdas).", cells, values.length);
            }
            System.arraycopy(values, 0, packed, c * cellCount, cellCount);
        }
        return NdArray.adopt(packed, prepend(channels.length, shape.dims()));
    }

    /**
     * Coordenadas ordenadas remodeladas con forma (size_x[, size_y[, size_z]], 3).
     */
    public NdArray reshapePoints(PointCloud sorted, GridShape shape) {
        Objects.requireNonNull(sorted, "Los puntos no pueden ser nulos.");
        long cells = shape.elementCount();
        if (sorted.size() != cells) {
            throw new ShapeMismatchException("No se pueden remodelar " + sorted.size() + " puntos en "
                    + shape + " (" + cells + " celdas).", cells, sorted.size());
        }
        int[] dims = shape.dims();
        int[] pointShape = new int[dims.length + 1];
        System.arraycopy(dims, 0, pointShape, 0, dims.length);
        pointShape[dims.length] = PointCloud.DIMENSIONS;
        return NdArray.adopt(sorted.toPacked(), pointShape);
    }

    /**
     * Apila frames de idéntica forma en un nuevo eje inicial (tiempo).
     */
    public NdArray stack(List<NdArray> frames) {
        Objects.requireNonNull(frames, "La lista de frames no puede ser nula.");
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("No hay frames que apilar.");
        }
        int[] frameShape = frames.get(0).shape();
        int frameSize = frames.get(0).size();
        double[] packed = new double[Math.multiplyExact(frames.size(), frameSize)];
        for (int t = 0; t < frames.size(); t++) {
            NdArray frame = frames.get(t);
            if (!Arrays.equals(frame.shape(), frameShape)) {
                throw new ShapeMismatchException("El frame " + t + " tiene forma " + frame
                        + " distinta de la del primer frame " + frames.get(0) + ".", frameSize, frame.size());
            }
            System.arraycopy(frame.flatten(), 0, packed, t * frameSize, frameSize);
        }
        return NdArray.adopt(packed, prepend(frames.size(), frameShape));
    }

    private static int checkedCellCount(GridShape shape) {
        long cells = shape.elementCount();
        if (cells > Integer.MAX_VALUE) {
            throw new ShapeMismatchException("La forma " + shape + " excede el tamaño máximo de un array Java.",
                    cells, Integer.MAX_VALUE);
        }
        return (int) cells;
    }

    private static int[] prepend(int first, int[] rest) {
        int[] result = new int[rest.length + 1];
        result[0] = first;
        System.arraycopy(rest, 0, result, 1, rest.length);
        return result;
    }
}
