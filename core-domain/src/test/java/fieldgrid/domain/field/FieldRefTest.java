package fieldgrid.domain.field;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Test unitario para {@link FieldRef}.
 * <p>
 * Verifica la traducción de la convención de sufijos a la variante tipada.
 */
class FieldRefTest {

    @Test
    @DisplayName("Sufijo _X/_Y/_Z: Debe producir una componente vectorial con el nombre base")
    void parse_componentSuffix_shouldReturnVectorComponent() {
        assertThat(FieldRef.parse("E_X")).isEqualTo(new FieldRef.VectorComponent("E", Axis.X));
        assertThat(FieldRef.parse("numeric_b_Y")).isEqualTo(new FieldRef.VectorComponent("numeric_b", Axis.Y));
        assertThat(FieldRef.parse("u_Z")).isEqualTo(new FieldRef.VectorComponent("u", Axis.Z));
    }

    @Test
    @DisplayName("Sufijo _Magnitude: Debe producir la variante Magnitude")
    void parse_magnitudeSuffix_shouldReturnMagnitude() {
        assertThat(FieldRef.parse("E_Magnitude")).isEqualTo(new FieldRef.Magnitude("E"));
    }

    @Test
    @DisplayName("Sin sufijo reconocido: Debe tratarse como escalar")
    void parse_plainName_shouldReturnScalar() {
        assertThat(FieldRef.parse("rho")).isEqualTo(new FieldRef.Scalar("rho"));
        // Sufijo en minúsculas no es una componente
        assertThat(FieldRef.parse("p_x")).isEqualTo(new FieldRef.Scalar("p_x"));
        // El sufijo sin nombre base tampoco
        assertThat(FieldRef.parse("_X")).isEqualTo(new FieldRef.Scalar("_X"));
    }

    @Test
    @DisplayName("channelName: Debe reconstruir el nombre solicitado")
    void channelName_shouldRoundTripRequestedName() {
        for (String name : new String[]{"rho", "E_X", "B_Z", "E_Magnitude"}) {
            assertThat(FieldRef.parse(name).channelName()).isEqualTo(name);
        }
    }

    @Test
    @DisplayName("Nombre vacío o nulo: Debe rechazarse")
    void parse_invalidName_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> FieldRef.parse(""));
        assertThrows(NullPointerException.class, () -> FieldRef.parse(null));
    }
}
