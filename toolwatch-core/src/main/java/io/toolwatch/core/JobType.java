package io.toolwatch.core;

public enum JobType {
    SCHEDULED {
        @Override
        public boolean isOperatorInitiated() {
            return false;
        }
    },
    MANUAL {
        @Override
        public boolean isOperatorInitiated() {
            return true;
        }
    },
    TRIGGERED {
        @Override
        public boolean isOperatorInitiated() {
            return true;
        }
    },
    BULK_IMPORT {
        @Override
        public boolean isOperatorInitiated() {
            return true;
        }
    };

    public abstract boolean isOperatorInitiated();
}
