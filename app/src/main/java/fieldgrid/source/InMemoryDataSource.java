package fieldgrid.source;

import fieldgrid.domain.grid.PointCloud;
import fieldgrid.domain.source.IDataSource;
import lombok.Builder;
import lombok.Singular;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Instantánea inmutable en memoria: un conjunto de puntos y sus campos.
 * <p>
 * Es estática: {@link #atTime(double)} devuelve la propia instancia. Se usa como frame de
 * {@link TimeSeriesDataSource} y como fuente de datos sintética.
 */
public final class InMemoryDataSource implements IDataSource {

    private final PointCloud points;
    private final Map<String, double[]> scalars;
    private final Map<String, double[][]> vectors;

    @Builder
    private InMemoryDataSource(PointCloud points,
                               @Singular Map<String, double[]> scalars,
                               @Singular Map<String, double[][]> vectors) {
        this.points = Objects.requireNonNull(points, "Los puntos no pueden ser nulos.");
        this.scalars = copyScalars(scalars);
        this.vectors = copyVectors(vectors);
    }

    public static InMemoryDataSource of(double[][] points, Map<String, double[]> scalars) {
        return InMemoryDataSource.builder()
                .points(PointCloud.of(points))
                .scalars(scalars)
                .build();
    }

    @Override
    public PointCloud getPoints() {
        return points;
    }

    @Override
    public Optional<double[]> findScalarField(String name) {
        double[] values = scalars.get(name);
        return values == null ? Optional.empty() : Optional.of(values.clone());
    }

    @Override
    public Optional<double[][]> findVectorField(String name) {
        double[][] values = vectors.get(name);
        return values == null ? Optional.empty() : Optional.of(deepCopy(values));
    }

    @Override
    public List<Double> getTimeValues() {
        return List.of();
    }

    @Override
    public IDataSource atTime(double time) {
        return this;
    }

    private static Map<String, double[]> copyScalars(Map<String, double[]> source) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, Objects.requireNonNull(v, "Campo escalar nulo: " + k).clone()));
        return copy;
    }

    private static Map<String, double[][]> copyVectors(Map<String, double[][]> source) {
        Map<String, double[][]> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, deepCopy(Objects.requireNonNull(v, "Campo vectorial nulo: " + k))));
        return copy;
    }

    private static double[][] deepCopy(double[][] rows) {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i] == null ? null : rows[i].clone();
        }
        return copy;
    }
}
