package com.example.catalog.stabilize;

/**
 * A lazily loaded collection that grows when prodded, such as an
 * infinite-scroll listing.
 *
 * @param <T> what the collection looks like once realized
 */
public interface GrowingCollection<T> {

    /** Asks the source to load more, e.g. one scroll step. */
    void grow();

    /** Current number of loaded items. */
    int size();

    /** The collection as currently loaded. */
    T realize();
}
