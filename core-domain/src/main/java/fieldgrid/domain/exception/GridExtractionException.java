package fieldgrid.domain.exception;

/**
 * Raíz de los errores de extracción.
 * <p>
 * Todos los errores son locales y fatales para la llamada de extracción que los produce:
 * no hay reintentos ni resultados parciales. Es el llamador quien decide si repite la
 * extracción con otros parámetros.
 */
public class GridExtractionException extends RuntimeException {

    public GridExtractionException(String message) {
        super(message);
    }

    public GridExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
