package fieldgrid.domain.exception;

import lombok.Getter;

/**
 * El campo solicitado no existe como escalar ni como vector en la fuente de datos.
 */
@Getter
public class FieldNotFoundException extends GridExtractionException {

    /**
     * Nombre tal y como lo pidió el llamador (ej: {@code "E_X"}).
     */
    private final String fieldName;

    public FieldNotFoundException(String fieldName, String message) {
        super(message);
        this.fieldName = fieldName;
    }

    public static FieldNotFoundException scalar(String name) {
        return new FieldNotFoundException(name,
                "El campo '" + name + "' no existe en la fuente de datos (ni escalar ni vectorial).");
    }

    public static FieldNotFoundException vector(String requested, String vectorName) {
        return new FieldNotFoundException(requested,
                "El campo '" + requested + "' no existe: no hay ningún campo vectorial '" + vectorName + "' en la fuente de datos.");
    }
}
