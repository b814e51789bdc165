package com.vigil.service.core.health;

public class InMemoryStorageCheck implements StorageCheck {

    @Override
    public String mode() {
        return "memory";
    }

    @Override
    public boolean usesDatabase() {
        return false;
    }

    @Override
    public boolean isReachable() {
        return true;
    }
}
