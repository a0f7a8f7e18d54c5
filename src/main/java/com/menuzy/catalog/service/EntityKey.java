package com.menuzy.catalog.service;

/**
 * Identity of a resolved reference: either a row already in the store or a record
 * at some position of the batch. Two keys are equal only when they point at the
 * same thing, which is what sibling display-order checks group by.
 */
record EntityKey(Long storedId, Integer batchIndex) {

    static EntityKey stored(Long id) {
        return new EntityKey(id, null);
    }

    static EntityKey batch(int index) {
        return new EntityKey(null, index);
    }

    boolean isStored() {
        return storedId != null;
    }

    @Override
    public String toString() {
        return isStored() ? "id " + storedId : "batch record #" + batchIndex;
    }
}
