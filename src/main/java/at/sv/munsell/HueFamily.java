package at.sv.munsell;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The ten hue families of the Munsell hue circle, declared in circular order.
 */
public enum HueFamily {
    R,
    YR,
    Y,
    GY,
    G,
    BG,
    B,
    PB,
    P,
    RP;

    private static final HueFamily[] CIRCLE = values();
    private static final List<String> ORDER = Arrays.stream(CIRCLE)
                                                    .map(HueFamily::code)
                                                    .collect(Collectors.toUnmodifiableList());
    private static final Map<String, Integer> INDEX_BY_CODE = createIndexByCode();

    public String code() {
        return name();
    }

    /**
     * @return position on the hue circle [0, 9]
     */
    public int index() {
        return ordinal();
    }

    public HueFamily previous() {
        return CIRCLE[(ordinal() + CIRCLE.length - 1) % CIRCLE.length];
    }

    public HueFamily next() {
        return CIRCLE[(ordinal() + 1) % CIRCLE.length];
    }

    public static HueFamily ofIndex(int index) {
        if (index < 0 || index >= CIRCLE.length) {
            throw new IllegalArgumentException("Hue family index must be between 0 and 9. Provided value: " + index);
        }
        return CIRCLE[index];
    }

    public static Optional<HueFamily> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String upperCase = code.toUpperCase(Locale.ROOT);
        return Arrays.stream(CIRCLE)
                     .filter(family -> family.code().equals(upperCase))
                     .findFirst();
    }

    /**
     * @return the family codes in circular order, starting with {@code R}
     */
    public static List<String> order() {
        return ORDER;
    }

    public static Map<String, Integer> indexByCode() {
        return INDEX_BY_CODE;
    }

    private static Map<String, Integer> createIndexByCode() {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (HueFamily family : CIRCLE) {
            map.put(family.code(), family.index());
        }
        return Collections.unmodifiableMap(map);
    }
}
