package io.supercast.client;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterEncoderTest {

    @Test
    void encodesNestedListsAndMapsWithBrackets() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("a", List.of(1, 2));
        params.put("b", Map.of("c", 3));

        assertThat(new ParameterEncoder().encode(params)).isEqualTo("a[0]=1&a[1]=2&b[c]=3");
    }

    @Test
    void indexesMapsAndListsInsideLists() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("items", List.of(Map.of("id", "x"), List.of(5)));

        assertThat(new ParameterEncoder().encode(params)).isEqualTo("items[0][id]=x&items[1][0]=5");
    }

    @Test
    void encodesArraysLikeLists() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("tags", new String[] {"news", "tech"});
        params.put("ids", new int[] {7});

        assertThat(new ParameterEncoder().encode(params)).isEqualTo("tags[0]=news&tags[1]=tech&ids[0]=7");
    }

    @Test
    void escapesKeysAndValuesButKeepsBrackets() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("title", "Hello World & more");
        params.put("meta", Map.of("k=y", "é"));
        params.put("empty", null);

        assertThat(new ParameterEncoder().encode(params))
                .isEqualTo("title=Hello+World+%26+more&meta[k%3Dy]=%C3%A9&empty=");
    }

    @Test
    void emptyParamsEncodeToEmptyString() {
        assertThat(new ParameterEncoder().encode(Map.of())).isEmpty();
        assertThat(new ParameterEncoder().encode(null)).isEmpty();
    }

    @Test
    void encodingSameInstanceTwiceUsesCache() {
        CountingValue value = new CountingValue();
        Map<String, Object> params = Map.of("v", value);
        ParameterEncoder encoder = new ParameterEncoder();

        String first = encoder.encode(params);
        String second = encoder.encode(params);

        assertThat(second).isSameAs(first);
        assertThat(value.calls).isEqualTo(1);
    }

    @Test
    void equalButDistinctMapsAreEncodedSeparately() {
        CountingValue value = new CountingValue();
        ParameterEncoder encoder = new ParameterEncoder();

        encoder.encode(new LinkedHashMap<>(Map.of("v", value)));
        encoder.encode(new LinkedHashMap<>(Map.of("v", value)));

        assertThat(value.calls).isEqualTo(2);
    }

    @Test
    void decodeIsNotSupported() {
        assertThatThrownBy(() -> new ParameterEncoder().decode("a=1"))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("does not implement decode");
    }

    private static final class CountingValue {
        int calls;

        @Override
        public String toString() {
            calls++;
            return "counted";
        }
    }
}
