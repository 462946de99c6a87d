package com.enterprise.campaign.analytics.infrastructure;

/**
 * Result of handing a snapshot to {@link CampaignStore#save}.
 */
public interface StoreOutcome {

    boolean persisted();

    /** All tables were replaced in the database. */
    record Persisted(int rows) implements StoreOutcome {
        @Override
        public boolean persisted() {
            return true;
        }
    }

    /** The database rejected the write; the snapshot is served from memory. */
    record InMemoryFallback(String reason) implements StoreOutcome {
        @Override
        public boolean persisted() {
            return false;
        }
    }
}
