package me.tavon.omnidock.registry;

public interface RegistryListener {

    /**
     * Called after each committed change, in commit order, while the registry still holds its lock.
     * Implementations must not block.
     */
    void onRegistryChanged(RegistryState previous, RegistryState current);
}
