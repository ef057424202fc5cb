package net.vortexdevelopment.vbind.binding;

import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for deriving target types from declared field types.
 */
class TargetTypeTest {

    enum Color {
        RED
    }

    @SuppressWarnings("unused")
    static class Declarations {
        int count;
        Color color;
        Optional<Integer> port;
        String[] names;
        List<Integer>[] listArray;
        Iterable<String> iterable;
        Collection<Long> collection;
        List<? extends Number> numbers;
        ArrayList<String> arrayList;
        LinkedList<Integer> linkedList;
        List rawList;
        Set<String> set;
        Map<String, String> map;
        List<List<String>> nested;
        Optional<List<String>> optionalList;
    }

    private static Type typeOf(String field) throws NoSuchFieldException {
        return Declarations.class.getDeclaredField(field).getGenericType();
    }

    @Test
    void scalarAndEnumShapes() throws Exception {
        assertThat(TargetType.of(typeOf("count"))).isEqualTo(TargetType.scalar(int.class));
        assertThat(TargetType.of(typeOf("color")).getShape()).isEqualTo(TargetShape.ENUM);
    }

    @Test
    void optionalIsNullable() throws Exception {
        TargetType type = TargetType.of(typeOf("port"));

        assertThat(type.getShape()).isEqualTo(TargetShape.NULLABLE);
        assertThat(type.getElementType()).isEqualTo(TargetType.scalar(Integer.class));
        assertThat(type.defaultValue()).isEqualTo(Optional.empty());
    }

    @Test
    void collectionShapes() throws Exception {
        assertThat(TargetType.of(typeOf("names"))).isEqualTo(TargetType.arrayOf(String.class));
        assertThat(TargetType.of(typeOf("iterable"))).isEqualTo(TargetType.readOnlyListOf(String.class));
        assertThat(TargetType.of(typeOf("collection"))).isEqualTo(TargetType.readOnlyListOf(Long.class));
        assertThat(TargetType.of(typeOf("numbers"))).isEqualTo(TargetType.fixedSizeListOf(Number.class));
        assertThat(TargetType.of(typeOf("arrayList"))).isEqualTo(TargetType.listOf(ArrayList.class, String.class));
        assertThat(TargetType.of(typeOf("linkedList")).getRawType()).isEqualTo(LinkedList.class);
    }

    @Test
    void rawListBindsStrings() throws Exception {
        assertThat(TargetType.of(typeOf("rawList"))).isEqualTo(TargetType.fixedSizeListOf(String.class));
    }

    @Test
    void arrayRawTypeIsArrayClass() {
        assertThat(TargetType.arrayOf(int.class).getRawType()).isEqualTo(int[].class);
    }

    @Test
    void unsupportedTypesFailFast() {
        assertThatThrownBy(() -> TargetType.of(typeOf("set"))).isInstanceOf(ConfigurationBindingException.class);
        assertThatThrownBy(() -> TargetType.of(typeOf("map"))).isInstanceOf(ConfigurationBindingException.class);
        assertThatThrownBy(() -> TargetType.of(typeOf("nested")))
                .isInstanceOf(ConfigurationBindingException.class)
                .hasMessageContaining("Nested");
        assertThatThrownBy(() -> TargetType.of(typeOf("listArray"))).isInstanceOf(ConfigurationBindingException.class);
        assertThatThrownBy(() -> TargetType.of(typeOf("optionalList"))).isInstanceOf(ConfigurationBindingException.class);
        assertThatThrownBy(() -> TargetType.listOf(List.class, String.class)).isInstanceOf(ConfigurationBindingException.class);
    }

    @Test
    void defaultValues() {
        assertThat(TargetType.scalar(int.class).defaultValue()).isEqualTo(0);
        assertThat(TargetType.scalar(boolean.class).defaultValue()).isEqualTo(false);
        assertThat(TargetType.scalar(Integer.class).defaultValue()).isNull();
        assertThat(TargetType.arrayOf(int.class).defaultValue()).isNull();
    }
}
