package net.vortexdevelopment.vbind.di;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public interface ServiceProvider {

    /**
     * Get a service from the provider
     * @param serviceType The class of the service
     * @return The service instance
     * @param <T> The type of the service
     * @throws ServiceNotFoundException if the service is not registered
     */
    @NotNull <T> T getRequired(@NotNull Class<T> serviceType);

    /**
     * Get a service from the provider
     * @param serviceType The class of the service
     * @return The service instance or null if it isn't registered
     * @param <T> The type of the service
     */
    @Nullable <T> T getOptional(@NotNull Class<T> serviceType);
}
