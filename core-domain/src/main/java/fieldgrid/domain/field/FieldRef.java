package fieldgrid.domain.field;

import java.util.Objects;

/**
 * Referencia tipada a un canal de datos solicitado por el llamador.
 * <p>
 * Sustituye el "olfateo" de sufijos en cadenas por una variante explícita:
 * <ul>
 *     <li>{@link Scalar}: campo escalar almacenado tal cual.</li>
 *     <li>{@link VectorComponent}: una componente (X/Y/Z) de un campo vectorial.</li>
 *     <li>{@link Magnitude}: módulo de un campo vectorial. Es una magnitud derivada que el
 *     backend no almacena, por lo que el lector la rechaza siempre.</li>
 * </ul>
 * El análisis de sufijos se hace una única vez en la frontera con {@link #parse(String)}.
 */
public interface FieldRef {

    String MAGNITUDE_SUFFIX = "_Magnitude";

    /**
     * Nombre con el que el canal aparece en los resultados (el nombre solicitado original).
     */
    String channelName();

    /**
     * Interpreta un nombre de canal con la convención de sufijos del backend.
     *
     * @param name Nombre solicitado (ej: {@code "rho"}, {@code "E_X"}, {@code "E_Magnitude"}).
     * @return La referencia tipada equivalente.
     */
    static FieldRef parse(String name) {
        Objects.requireNonNull(name, "El nombre del campo no puede ser nulo.");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("El nombre del campo no puede estar vacío.");
        }
        for (Axis axis : Axis.values()) {
            String suffix = axis.suffix();
            if (name.endsWith(suffix) && name.length() > suffix.length()) {
                return new VectorComponent(name.substring(0, name.length() - suffix.length()), axis);
            }
        }
        if (name.endsWith(MAGNITUDE_SUFFIX) && name.length() > MAGNITUDE_SUFFIX.length()) {
            return new Magnitude(name.substring(0, name.length() - MAGNITUDE_SUFFIX.length()));
        }
        return new Scalar(name);
    }

    static FieldRef scalar(String name) {
        return new Scalar(name);
    }

    static FieldRef component(String vectorName, Axis axis) {
        return new VectorComponent(vectorName, axis);
    }

    record Scalar(String name) implements FieldRef {
        public Scalar {
            Objects.requireNonNull(name, "El nombre del campo escalar no puede ser nulo.");
        }

        @Override
        public String channelName() {
            return name;
        }
    }

    record VectorComponent(String vectorName, Axis axis) implements FieldRef {
        public VectorComponent {
            Objects.requireNonNull(vectorName, "El nombre del campo vectorial no puede ser nulo.");
            Objects.requireNonNull(axis, "El eje de la componente no puede ser nulo.");
        }

        @Override
        public String channelName() {
            return vectorName + axis.suffix();
        }
    }

    record Magnitude(String vectorName) implements FieldRef {
        public Magnitude {
            Objects.requireNonNull(vectorName, "El nombre del campo vectorial no puede ser nulo.");
        }

        @Override
        public String channelName() {
            return vectorName + MAGNITUDE_SUFFIX;
        }
    }
}
