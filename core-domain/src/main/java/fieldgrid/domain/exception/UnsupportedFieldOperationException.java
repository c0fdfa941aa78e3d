package fieldgrid.domain.exception;

import lombok.Getter;

/**
 * Se ha pedido una magnitud derivada que no se puede reconstruir leyendo una única componente
 * (p.ej. {@code "E_Magnitude"}). Nunca se aproxima en silencio.
 */
@Getter
public class UnsupportedFieldOperationException extends GridExtractionException {

    private final String fieldName;

    public UnsupportedFieldOperationException(String fieldName) {
        super("El campo '" + fieldName + "' es una magnitud derivada y no se almacena en la fuente de datos; "
                + "solicita las componentes _X, _Y, _Z por separado.");
        this.fieldName = fieldName;
    }
}
