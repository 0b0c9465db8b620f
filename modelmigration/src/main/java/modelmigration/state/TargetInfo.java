package modelmigration.state;

import modelmigration.exceptions.NotValidException;
import modelmigration.names.Tag;

import java.util.List;

/**
 * How to reach and authenticate with the controller a model migrates to.
 *
 * <p>Either a password or a token must be given. {@link #toString()} never
 * includes either.
 *
 * @param controllerTag the target controller
 * @param addrs API addresses of the target controller, {@code host:port}
 * @param caCert CA certificate of the target controller, PEM encoded
 * @param authTag the identity to authenticate as
 * @param password password for {@code authTag}, may be empty if a token is given
 * @param token bearer token for {@code authTag}, may be empty if a password is given
 */
public record TargetInfo(Tag controllerTag,
                         List<String> addrs,
                         String caCert,
                         Tag authTag,
                         String password,
                         String token) {

    public TargetInfo {
        addrs = addrs == null ? List.of() : List.copyOf(addrs);
        password = password == null ? "" : password;
        token = token == null ? "" : token;
    }

    public static TargetInfo withPassword(Tag controllerTag, List<String> addrs, String caCert, Tag authTag,
                                          String password) {
        return new TargetInfo(controllerTag, addrs, caCert, authTag, password, "");
    }

    /**
     * Checks every field, stopping at the first problem.
     *
     * @throws NotValidException naming the offending field
     */
    public void validate() throws NotValidException {
        if (controllerTag == null || controllerTag.kind() != Tag.Kind.CONTROLLER || !controllerTag.isValid()) {
            throw NotValidException.of("ControllerTag", "ControllerTag");
        }
        if (addrs.isEmpty()) {
            throw NotValidException.of("Addrs", "empty Addrs");
        }
        for (String addr : addrs) {
            if (!isHostPort(addr)) {
                throw NotValidException.of("Addrs", "\"" + addr + "\" in Addrs");
            }
        }
        if (caCert == null || caCert.isEmpty()) {
            throw NotValidException.of("CACert", "empty CACert");
        }
        if (authTag == null || authTag.id().isEmpty()) {
            throw NotValidException.of("AuthTag", "empty AuthTag");
        }
        if (password.isEmpty() && token.isEmpty()) {
            throw NotValidException.of("Password", "empty Password");
        }
    }

    static boolean isHostPort(String addr) {
        if (addr == null) {
            return false;
        }
        int colon = addr.lastIndexOf(':');
        if (colon <= 0 || colon == addr.length() - 1) {
            return false;
        }
        String host = addr.substring(0, colon);
        if (host.startsWith("[") != host.endsWith("]")) {
            return false;
        }
        if (!host.startsWith("[") && host.indexOf(':') >= 0) {
            return false;
        }
        String port = addr.substring(colon + 1);
        if (port.length() > 5 || !port.chars().allMatch(Character::isDigit)) {
            return false;
        }
        int value = Integer.parseInt(port);
        return value >= 1 && value <= 65535;
    }

    @Override
    public String toString() {
        return "TargetInfo{" +
                "controllerTag=" + controllerTag +
                ", addrs=" + addrs +
                ", authTag=" + authTag +
                ", password=" + (password.isEmpty() ? "<none>" : "<hidden>") +
                ", token=" + (token.isEmpty() ? "<none>" : "<hidden>") +
                '}';
    }
}
