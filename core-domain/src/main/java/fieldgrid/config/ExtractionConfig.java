package fieldgrid.config;

import fieldgrid.domain.field.Axis;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Configuración inmutable de una extracción.
 * <p>
 * Los valores por defecto reproducen el comportamiento histórico: línea a lo largo de X,
 * sin filtro de rango y validación de rejilla limitada al producto de extensiones.
 */
@Value
@Builder
@With
public class ExtractionConfig {

    /**
     * Eje cuyas coordenadas se devuelven en la extracción 1D.
     */
    @Builder.Default
    Axis lineAxis = Axis.X;

    /**
     * Si no es nulo, en 1D solo se conservan las muestras con coordenada >= lineMin.
     */
    Double lineMin;

    /**
     * Si no es nulo, en 1D solo se conservan las muestras con coordenada <= lineMax.
     */
    Double lineMax;

    /**
     * Nivel de verificación de la hipótesis de rejilla separable.
     */
    @Builder.Default
    GridValidation gridValidation = GridValidation.PRODUCT_ONLY;

    public static ExtractionConfig defaults() {
        return ExtractionConfig.builder().build();
    }

    /**
     * Estrategias de verificación de la forma inferida.
     */
    public enum GridValidation {
        /**
         * Solo comprueba que size_x * size_y (* size_z) == N.
         * Una rejilla no separable (p.ej. con refinamiento adaptativo) cuyo producto coincida
         * NO se detecta: limitación conocida.
         */
        PRODUCT_ONLY,

        /**
         * Además comprueba que los puntos ordenados recorren exactamente el producto cartesiano
         * de los valores distintos de cada eje.
         */
        STRICT
    }
}
