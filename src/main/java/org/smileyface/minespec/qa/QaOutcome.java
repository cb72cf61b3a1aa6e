package org.smileyface.minespec.qa;

import org.smileyface.minespec.model.ValidatedSpec;

import java.util.Objects;

/**
 * Result of a QA check: the record is either accepted as it is or rejected with a reason.
 */
public interface QaOutcome {

    ValidatedSpec spec();

    boolean isAccepted();

    record Accepted(ValidatedSpec spec) implements QaOutcome {
        public Accepted {
            Objects.requireNonNull(spec, "spec");
        }

        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    /**
     * @param spec   the record with status REJECTED and the reason as status reason
     * @param reason the failed check
     */
    record Rejected(ValidatedSpec spec, String reason) implements QaOutcome {
        public Rejected {
            Objects.requireNonNull(spec, "spec");
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isAccepted() {
            return false;
        }
    }
}
