package fieldgrid.field;

import fieldgrid.domain.exception.FieldNotFoundException;
import fieldgrid.domain.exception.ShapeMismatchException;
import fieldgrid.domain.exception.UnsupportedFieldOperationException;
import fieldgrid.domain.field.FieldRef;
import fieldgrid.domain.source.IDataSource;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Lee de la fuente de datos los valores crudos (sin ordenar) de un canal.
 * <p>
 * Reglas de resolución:
 * <ol>
 *     <li>{@link FieldRef.VectorComponent}: se busca el campo vectorial base y se toma la columna del eje.</li>
 *     <li>{@link FieldRef.Magnitude}: error explícito, el módulo no se almacena.</li>
 *     <li>{@link FieldRef.Scalar}: se busca el campo escalar directamente.</li>
 * </ol>
 * Los arrays devueltos son siempre copias nuevas, tienen una muestra por punto y están en el
 * orden original de la fuente.
 */
@Slf4j
public class FieldArrayReader {

    /**
     * Variante que interpreta la convención de sufijos ({@code _X}, {@code _Y}, {@code _Z}, {@code _Magnitude}).
     */
    public double[] read(IDataSource source, String fieldName) {
        return read(source, FieldRef.parse(fieldName));
    }

    public double[] read(IDataSource source, FieldRef field) {
        Objects.requireNonNull(source, "La fuente de datos no puede ser nula.");
        Objects.requireNonNull(field, "La referencia de campo no puede ser nula.");

        double[] values;
        if (field instanceof FieldRef.VectorComponent component) {
            values = readComponent(source, component);
        } else if (field instanceof FieldRef.Magnitude) {
            throw new UnsupportedFieldOperationException(field.channelName());
        } else if (field instanceof FieldRef.Scalar scalar) {
            String name = scalar.name();
            values = source.findScalarField(name)
                    .orElseThrow(() -> FieldNotFoundException.scalar(name))
                    .clone();
        } else {
            throw new IllegalStateException("Tipo de referencia de campo no soportado: " + field.getClass().getName());
        }

        int expected = source.getPoints().size();
        if (values.length != expected) {
            throw new ShapeMismatchException("El campo '" + field.channelName() + "' tiene " + values.length
                    + " valores pero la fuente tiene " + expected + " puntos.", expected, values.length);
        }
        log.trace("Leído el canal '{}' ({} muestras).", field.channelName(), values.length);
        return values;
    }

    /**
     * Lee varios canales en el orden solicitado. Devuelve (canales, muestras).
     */
    public double[][] readAll(IDataSource source, List<FieldRef> fields) {
        Objects.requireNonNull(fields, "La lista de campos no puede ser nula.");
        double[][] channels = new double[fields.size()][];
        for (int c = 0; c < fields.size(); c++) {
            channels[c] = read(source, fields.get(c));
        }
        return channels;
    }

    private double[] readComponent(IDataSource source, FieldRef.VectorComponent component) {
        String vectorName = component.vectorName();
        double[][] vector = source.findVectorField(vectorName)
                .orElseThrow(() -> FieldNotFoundException.vector(component.channelName(), vectorName));

        int axis = component.axis().index();
        double[] column = new double[vector.length];
        for (int i = 0; i < vector.length; i++) {
            double[] tuple = vector[i];
            if (tuple == null || tuple.length <= axis) {
                throw new ShapeMismatchException("La muestra " + i + " del campo vectorial '" + vectorName
                        + "' no tiene componente " + component.axis() + ".", 3, tuple == null ? 0 : tuple.length);
            }
            column[i] = tuple[axis];
        }
        return column;
    }
}
