package modelmigration.names;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String identity of an entity known to a controller.
 *
 * <p>A tag renders as {@code <kind>-<id>}, for example {@code machine-0},
 * {@code unit-mysql-0}, {@code user-admin} or {@code controller-<uuid>}.
 * Unit ids ({@code mysql/0}) and container machine ids ({@code 0/lxd/0})
 * contain slashes, which are rendered as dashes.
 *
 * <p>Tags are plain values: two tags are equal when kind and id are equal.
 * Use {@link #isValid()} to check the id against the rules for its kind.
 *
 * @param kind the entity kind
 * @param id the kind-specific identifier
 */
public record Tag(Kind kind, String id) {

    private static final Pattern MACHINE_ID = Pattern.compile("(0|[1-9][0-9]*)(/[a-z]+/(0|[1-9][0-9]*))*");
    private static final Pattern UNIT_ID = Pattern.compile("[a-z][a-z0-9]*(-[a-z0-9]*[a-z][a-z0-9]*)*/(0|[1-9][0-9]*)");
    private static final Pattern USER_ID = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9.+-]*[a-zA-Z0-9](@[a-zA-Z0-9.-]+)?|[a-zA-Z0-9]");
    private static final Pattern UUID_ID = Pattern.compile(
            "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");

    /**
     * Entity kinds understood by the coordinator.
     */
    public enum Kind {
        MACHINE("machine"),
        UNIT("unit"),
        USER("user"),
        CONTROLLER("controller"),
        MODEL("model");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }

        static Kind fromPrefix(String prefix) {
            for (Kind kind : values()) {
                if (kind.prefix.equals(prefix)) {
                    return kind;
                }
            }
            return null;
        }
    }

    public Tag {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
    }

    public static Tag machine(String id) {
        return new Tag(Kind.MACHINE, id);
    }

    public static Tag unit(String id) {
        return new Tag(Kind.UNIT, id);
    }

    public static Tag user(String id) {
        return new Tag(Kind.USER, id);
    }

    public static Tag controller(String uuid) {
        return new Tag(Kind.CONTROLLER, uuid);
    }

    public static Tag model(String uuid) {
        return new Tag(Kind.MODEL, uuid);
    }

    /**
     * Parses the string form of a tag.
     *
     * @param text a tag such as {@code unit-mysql-0}
     * @return the parsed tag
     * @throws IllegalArgumentException if the text is not a valid tag
     */
    public static Tag parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("\"null\" is not a valid tag");
        }
        int dash = text.indexOf('-');
        Kind kind = dash > 0 ? Kind.fromPrefix(text.substring(0, dash)) : null;
        if (kind == null) {
            throw new IllegalArgumentException("\"" + text + "\" is not a valid tag");
        }
        String id = text.substring(dash + 1);
        if (kind == Kind.MACHINE) {
            // container ids render 0/lxd/0 as 0-lxd-0
            id = id.replace('-', '/');
        } else if (kind == Kind.UNIT) {
            int last = id.lastIndexOf('-');
            if (last < 0) {
                throw new IllegalArgumentException("\"" + text + "\" is not a valid unit tag");
            }
            id = id.substring(0, last) + "/" + id.substring(last + 1);
        }
        Tag tag = new Tag(kind, id);
        if (!tag.isValid()) {
            throw new IllegalArgumentException("\"" + text + "\" is not a valid " + kind.prefix() + " tag");
        }
        return tag;
    }

    /**
     * Checks the id against the naming rules of the tag's kind.
     */
    public boolean isValid() {
        return switch (kind) {
            case MACHINE -> MACHINE_ID.matcher(id).matches();
            case UNIT -> UNIT_ID.matcher(id).matches();
            case USER -> USER_ID.matcher(id).matches();
            case CONTROLLER, MODEL -> UUID_ID.matcher(id).matches();
        };
    }

    @Override
    public String toString() {
        return kind.prefix() + "-" + id.replace('/', '-');
    }
}
