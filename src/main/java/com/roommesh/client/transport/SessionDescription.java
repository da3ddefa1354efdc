package com.roommesh.client.transport;

import java.util.Locale;
import java.util.Objects;

public final class SessionDescription {

    public enum Type {
        OFFER, ANSWER, ROLLBACK;

        public String canonicalForm() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Type fromCanonicalForm(String canonical) {
            return Type.valueOf(canonical.toUpperCase(Locale.ROOT));
        }
    }

    private final Type type;
    private final String sdp;

    public SessionDescription(Type type, String sdp) {
        this.type = Objects.requireNonNull(type, "type");
        this.sdp = sdp;
    }

    public static SessionDescription rollback() {
        return new SessionDescription(Type.ROLLBACK, "");
    }

    public Type getType() { return type; }

    public String getSdp() { return sdp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionDescription)) return false;
        SessionDescription other = (SessionDescription) o;
        return type == other.type && Objects.equals(sdp, other.sdp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, sdp);
    }

    @Override
    public String toString() {
        return type.canonicalForm();
    }
}
