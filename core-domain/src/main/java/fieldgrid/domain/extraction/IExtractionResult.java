package fieldgrid.domain.extraction;

import java.util.List;

/**
 * Contrato común de los resultados de extracción.
 * <p>
 * Permite que el exportador/graficador externo recorra los canales sin conocer si el
 * resultado es una línea, una rejilla o una serie temporal.
 */
public interface IExtractionResult {

    /**
     * Nombres de los canales en el orden solicitado. Es el primer eje de los datos
     * (o el segundo, tras el tiempo, en las series apiladas).
     */
    List<String> getChannels();

    default int getChannelCount() {
        return getChannels().size();
    }

    /**
     * Posición de un canal dentro del eje de canales.
     *
     * @throws IllegalArgumentException si el canal no se solicitó en esta extracción.
     */
    default int channelIndex(String channel) {
        int index = getChannels().indexOf(channel);
        if (index < 0) {
            throw new IllegalArgumentException("El canal '" + channel + "' no forma parte de la extracción " + getChannels());
        }
        return index;
    }
}
