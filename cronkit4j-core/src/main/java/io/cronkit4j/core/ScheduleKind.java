package io.cronkit4j.core;

public enum ScheduleKind {
    AT {
        @Override
        public boolean isRecurring() {
            return false;
        }
    },
    EVERY {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    CRON {
        @Override
        public boolean isRecurring() {
            return true;
        }
    };

    public abstract boolean isRecurring();
}
