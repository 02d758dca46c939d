package com.luanvv.listings.store;

import com.luanvv.listings.model.Dataset;

/** Where the canonical dataset lives between runs. Read once at the start of a run, written once at the end. */
public interface DatasetStore {

    /** @return the stored dataset, or an empty one on the first run */
    Dataset read();

    void write(Dataset dataset);
}
