package fieldgrid.domain.exception;

import lombok.Getter;

import java.util.OptionalInt;

/**
 * El número de muestras no encaja con la forma de rejilla inferida o suministrada.
 * <p>
 * En las series temporales identifica además el índice (y el valor) del instante
 * cuyo frame no coincide con la geometría del primero.
 */
public class ShapeMismatchException extends GridExtractionException {

    @Getter
    private final long expectedCount;

    @Getter
    private final long actualCount;

    private final Integer timeIndex;

    private final Double timeValue;

    public ShapeMismatchException(String message, long expectedCount, long actualCount) {
        this(message, expectedCount, actualCount, null, null);
    }

    private ShapeMismatchException(String message, long expectedCount, long actualCount,
                                   Integer timeIndex, Double timeValue) {
        super(message);
        this.expectedCount = expectedCount;
        this.actualCount = actualCount;
        this.timeIndex = timeIndex;
        this.timeValue = timeValue;
    }

    /**
     * Reenvuelve un error de forma producido al procesar el frame {@code timeIndex}.
     */
    public static ShapeMismatchException atTimeIndex(ShapeMismatchException cause, int timeIndex, double timeValue) {
        ShapeMismatchException wrapped = new ShapeMismatchException(
                "Frame en el índice temporal " + timeIndex + " (t=" + timeValue + "): " + cause.getMessage(),
                cause.getExpectedCount(), cause.getActualCount(), timeIndex, timeValue);
        wrapped.initCause(cause);
        return wrapped;
    }

    /**
     * Índice del instante que falló, vacío si el error no procede de una serie temporal.
     */
    public OptionalInt getTimeIndex() {
        return timeIndex == null ? OptionalInt.empty() : OptionalInt.of(timeIndex);
    }

    public Double getTimeValue() {
        return timeValue;
    }
}
