package paramhandling;

import edu.umich.andykong.spikeshepherd.interpolation.InterpolationKind;
import edu.umich.andykong.spikeshepherd.paramhandling.DoubleParameter;
import edu.umich.andykong.spikeshepherd.paramhandling.EnumParameter;
import edu.umich.andykong.spikeshepherd.paramhandling.IntegerParameter;
import edu.umich.andykong.spikeshepherd.paramhandling.InvalidParameterException;
import edu.umich.andykong.spikeshepherd.paramhandling.ParameterGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParameterGroupTest {
    private ParameterGroup group;

    @BeforeEach
    public void setUp() {
        group = new ParameterGroup("test");
        group.addParam(new DoubleParameter("rel", 0, 1, 0.8, "relative height"));
        group.addParam(new DoubleParameter("threshold", 0, Double.MAX_VALUE, null, "required"));
        group.addParam(new IntegerParameter("window", 1, 100, 10, "window"));
        group.addParam(new EnumParameter<>("kind", InterpolationKind.class, InterpolationKind.LINEAR, "kind"));
    }

    @Test
    public void doubleBounds() {
        DoubleParameter p = new DoubleParameter("rel", 0, 1, null, "");
        assertFalse(p.isSet());
        assertFalse(p.isValid(0.0));
        assertTrue(p.isValid(1.0));
        assertTrue(p.isValid(1e-9));
        assertFalse(p.isValid(1.0000001));
        assertFalse(p.isValid(Double.NaN));

        p.parseValue(" 0.5 ");
        assertEquals(0.5, (double) p.getValue());

        InvalidParameterException e = assertThrows(InvalidParameterException.class, () -> p.setValue(0.0));
        assertEquals("rel", e.getKey());
        assertThrows(InvalidParameterException.class, () -> p.parseValue("half"));
        assertThrows(InvalidParameterException.class, () -> p.setValue(null));
    }

    @Test
    public void integerBounds() {
        IntegerParameter p = new IntegerParameter("window", 1, 100, 10, "");
        assertEquals(10, p.getDefaultValue());
        assertThrows(InvalidParameterException.class, () -> p.setValue(0));
        assertThrows(InvalidParameterException.class, () -> p.parseValue("2.5"));
        p.parseValue("100");
        assertEquals(100, (int) p.getValue());
        assertThrows(InvalidParameterException.class, () -> new IntegerParameter("bad", 1, 2, 5, ""));
    }

    @Test
    public void enumParsing() {
        EnumParameter<InterpolationKind> p = new EnumParameter<>("kind", InterpolationKind.class, null, "");
        assertFalse(p.isSet());
        p.parseValue("Cubic");
        assertEquals(InterpolationKind.CUBIC, p.getValue());
        InvalidParameterException e = assertThrows(InvalidParameterException.class, () -> p.parseValue("nearest"));
        assertTrue(e.getMessage().contains("quadratic"));
        assertThrows(InvalidParameterException.class, () -> p.setValue(null));
    }

    @Test
    public void groupAccess() {
        group.setParamValue("window", 4);
        assertEquals(4, (int) group.<Integer>getParamValue("window"));
        group.parseParamValue("kind", "quadratic");
        assertEquals(InterpolationKind.QUADRATIC, group.<InterpolationKind>getParamValue("kind"));

        InvalidParameterException e = assertThrows(InvalidParameterException.class, () -> group.getParam("nope"));
        assertEquals("nope", e.getKey());
        assertThrows(InvalidParameterException.class, () -> group.parseParamValue("window", null));
        assertThrows(IllegalArgumentException.class,
                () -> group.addParam(new IntegerParameter("window", 1, 2, 1, "")));
    }

    @Test
    public void checkRequired() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class, () -> group.checkRequired());
        assertEquals("threshold", e.getKey());
        group.setParamValue("threshold", 2.0);
        assertDoesNotThrow(() -> group.checkRequired());
        assertTrue(group.describe().contains("threshold = 2.0"));
    }
}
