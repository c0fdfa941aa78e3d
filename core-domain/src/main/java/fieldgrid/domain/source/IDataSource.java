package fieldgrid.domain.source;

import fieldgrid.domain.grid.PointCloud;

import java.util.List;
import java.util.Optional;

/**
 * Contrato con el backend externo de carga/visualización.
 * <p>
 * Representa una instantánea: los puntos y los campos devueltos corresponden todos al
 * mismo instante. Reevaluar en otro instante NO muta la instancia, devuelve otra
 * ({@link #atTime(double)}), de modo que no hay estado global compartido entre llamadas.
 */
public interface IDataSource {

    /**
     * Lista de puntos de la instantánea, una coordenada por muestra.
     */
    PointCloud getPoints();

    /**
     * Valores por muestra de un campo escalar, o vacío si no existe.
     */
    Optional<double[]> findScalarField(String name);

    /**
     * Valores por muestra de un campo vectorial como filas (c0, c1, c2), o vacío si no existe.
     */
    Optional<double[][]> findVectorField(String name);

    /**
     * Instantes de tiempo declarados por la fuente (vacío para datos estáticos).
     */
    List<Double> getTimeValues();

    /**
     * Reevalúa la fuente en el instante {@code time}. Puede ser costoso.
     *
     * @return Una instantánea evaluada en ese instante.
     */
    IDataSource atTime(double time);
}
