package io.gigdraft.core;

/**
 * Lifecycle of an editing session's draft.
 *
 * <p>EDITING -&gt; PUBLISHING -&gt; PUBLISHED, or EDITING -&gt; DISCARDED. A failed publish returns
 * to EDITING so the user can retry.
 */
public enum DraftState {
    EDITING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    PUBLISHING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    PUBLISHED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    DISCARDED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();
}
