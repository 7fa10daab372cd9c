package com.pbpreminder.bot.store;

import com.pbpreminder.bot.model.ActivitySnapshot;

public interface SnapshotStore {

    ActivitySnapshot load();

    void save(ActivitySnapshot snapshot);
}
