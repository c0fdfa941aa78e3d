package fieldgrid.grid;

import fieldgrid.config.ExtractionConfig.GridValidation;
import fieldgrid.domain.exception.ShapeMismatchException;
import fieldgrid.domain.field.Axis;
import fieldgrid.domain.grid.GridShape;
import fieldgrid.domain.grid.PointCloud;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Objects;

/**
 * Infiere la extensión por eje de una rejilla estructurada a partir de los puntos ORDENADOS.
 * <p>
 * Algoritmo: se toma el primer punto como referencia y, para cada eje, se cuentan los
 * puntos que comparten con él todas las demás coordenadas (la "fila" de referencia de ese eje).
 * <ul>
 *     <li>2D: size_x = #(y == y0), size_y = #(x == x0).</li>
 *     <li>3D: size_x = #((y,z) == (y0,z0)), size_y = #((x,z) == (x0,z0)), size_z = #((x,y) == (x0,y0)).</li>
 * </ul>
 * HIPÓTESIS: la rejilla es un producto cartesiano completo. Siempre se verifica que el producto
 * de extensiones sea N; la verificación completa del producto cartesiano solo se hace en
 * {@link GridValidation#STRICT}.
 */
@Slf4j
public class GridShapeInference {

    private final GridValidation validation;

    public GridShapeInference() {
        this(GridValidation.PRODUCT_ONLY);
    }

    public GridShapeInference(GridValidation validation) {
        this.validation = Objects.requireNonNull(validation, "La estrategia de validación no puede ser nula.");
    }

    /**
     * @param sorted Puntos ya ordenados por (x, y, z).
     * @param rank   1, 2 o 3. En rango 1 la forma es simplemente (N).
     */
    public GridShape infer(PointCloud sorted, int rank) {
        Objects.requireNonNull(sorted, "La lista de puntos no puede ser nula.");
        if (sorted.isEmpty()) {
            throw new ShapeMismatchException("No se puede inferir una rejilla sin puntos.", 1, 0);
        }

        GridShape shape = switch (rank) {
            case 1 -> GridShape.of(sorted.size());
            case 2 -> GridShape.of(
                    countMatching(sorted, Axis.Y),
                    countMatching(sorted, Axis.X));
            case 3 -> GridShape.of(
                    countMatching(sorted, Axis.Y, Axis.Z),
                    countMatching(sorted, Axis.X, Axis.Z),
                    countMatching(sorted, Axis.X, Axis.Y));
            default -> throw new IllegalArgumentException("Rango de rejilla no soportado: " + rank);
        };

        if (shape.elementCount() != sorted.size()) {
            throw new ShapeMismatchException("La forma inferida " + shape + " cubre " + shape.elementCount()
                    + " celdas pero hay " + sorted.size() + " muestras: la rejilla no es un producto cartesiano completo.",
                    shape.elementCount(), sorted.size());
        }
        if (validation == GridValidation.STRICT && rank > 1) {
            verifyCartesianProduct(sorted, shape);
        }
        log.debug("Forma de rejilla inferida: {}", shape);
        return shape;
    }

    public GridShape infer2d(PointCloud sorted) {
        return infer(sorted, 2);
    }

    public GridShape infer3d(PointCloud sorted) {
        return infer(sorted, 3);
    }

    /**
     * Cuenta los puntos cuyas coordenadas en {@code fixed} coinciden con las del primer punto.
     */
    private static int countMatching(PointCloud points, Axis... fixed) {
        int count = 0;
        for (int i = 0; i < points.size(); i++) {
            boolean match = true;
            for (Axis axis : fixed) {
                if (Double.compare(points.coordinate(i, axis), points.coordinate(0, axis)) != 0) {
                    match = false;
                    break;
                }
            }
            if (match) {
                count++;
            }
        }
        return count;
    }

    private static void verifyCartesianProduct(PointCloud sorted, GridShape shape) {
        int rank = shape.rank();
        double[][] distinct = new double[rank][];
        for (int a = 0; a < rank; a++) {
            distinct[a] = Arrays.stream(sorted.axisValues(Axis.fromIndex(a))).sorted().distinct().toArray();
            if (distinct[a].length != shape.size(a)) {
                throw new ShapeMismatchException("Rejilla no separable: el eje " + Axis.fromIndex(a) + " tiene "
                        + distinct[a].length + " valores distintos pero la forma inferida es " + shape + ".",
                        shape.size(a), distinct[a].length);
            }
        }

        // Recorrido row-major: el punto k debe ser (dx[ix], dy[iy], dz[iz]).
        int[] index = new int[rank];
        for (int k = 0; k < sorted.size(); k++) {
            for (int a = 0; a < rank; a++) {
                Axis axis = Axis.fromIndex(a);
                if (Double.compare(sorted.coordinate(k, axis), distinct[a][index[a]]) != 0) {
                    throw new ShapeMismatchException("Rejilla no separable: la muestra " + k
                            + " no ocupa la posición " + Arrays.toString(index) + " del producto cartesiano.",
                            shape.elementCount(), sorted.size());
                }
            }
            for (int a = rank - 1; a >= 0; a--) {
                if (++index[a] < shape.size(a)) break;
                index[a] = 0;
            }
        }
    }
}
