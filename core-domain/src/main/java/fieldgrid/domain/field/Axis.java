package fieldgrid.domain.field;

/**
 * Ejes cartesianos de una muestra.
 * <p>
 * El orden de declaración coincide con el índice de componente de los campos vectoriales
 * (X=0, Y=1, Z=2) y con el sufijo que usa el backend de visualización para nombrar cada
 * componente por separado ({@code "E_X"}, {@code "E_Y"}, {@code "E_Z"}).
 */
public enum Axis {
    X, Y, Z;

    /**
     * Índice de la componente dentro de una tupla (x, y, z).
     */
    public int index() {
        return ordinal();
    }

    /**
     * Sufijo de componente, p.ej. {@code "_X"}.
     */
    public String suffix() {
        return "_" + name();
    }

    public static Axis fromIndex(int index) {
        if (index < 0 || index >= values().length) {
            throw new IllegalArgumentException("Índice de eje fuera de rango [0, 2]: " + index);
        }
        return values()[index];
    }
}
