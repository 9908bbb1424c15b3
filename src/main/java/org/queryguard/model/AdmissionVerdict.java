package org.queryguard.model;

import java.util.Objects;

// Outcome of admission: the text to execute, possibly rewritten, or why it was refused
public abstract class AdmissionVerdict {

    private AdmissionVerdict() {
    }

    public static AdmissionVerdict accepted(String finalText) {
        return new Accepted(finalText);
    }

    public static AdmissionVerdict rejected(RejectionReason reason) {
        return new Rejected(reason);
    }

    public abstract boolean isAccepted();

    public static final class Accepted extends AdmissionVerdict {
        private final String finalText;

        private Accepted(String finalText) {
            this.finalText = Objects.requireNonNull(finalText, "finalText");
        }

        public String finalText() {
            return finalText;
        }

        @Override
        public boolean isAccepted() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Accepted && finalText.equals(((Accepted) o).finalText);
        }

        @Override
        public int hashCode() {
            return finalText.hashCode();
        }

        @Override
        public String toString() {
            return "Accepted{" + finalText + "}";
        }
    }

    public static final class Rejected extends AdmissionVerdict {
        private final RejectionReason reason;

        private Rejected(RejectionReason reason) {
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public RejectionReason reason() {
            return reason;
        }

        @Override
        public boolean isAccepted() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Rejected && reason == ((Rejected) o).reason;
        }

        @Override
        public int hashCode() {
            return reason.hashCode();
        }

        @Override
        public String toString() {
            return "Rejected{" + reason + "}";
        }
    }
}
