package net.vortexdevelopment.vbind.di.resolver;

import net.vortexdevelopment.vbind.annotation.Inject;
import net.vortexdevelopment.vbind.annotation.InjectConfiguration;
import net.vortexdevelopment.vbind.annotation.OptionalDependency;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ArgumentResolverRegistryTest {

    @Test
    void resolversAreLookedUpByAnnotation() {
        // Arrange
        ArgumentResolverRegistry registry = new ArgumentResolverRegistry();
        InjectArgumentResolver resolver = new InjectArgumentResolver();

        // Act
        registry.registerResolver(Inject.class, resolver);

        // Assert
        assertThat(registry.hasResolver(Inject.class)).isTrue();
        assertThat(registry.getResolver(Inject.class)).isSameAs(resolver);
        assertThat(registry.hasResolver(InjectConfiguration.class)).isFalse();
        assertThat(registry.getResolver(InjectConfiguration.class)).isNull();
        assertThat(registry.hasResolverOfType(InjectArgumentResolver.class)).isTrue();
    }

    @Test
    void resolversAreOrderedByPriorityWithoutDuplicates() {
        // Arrange
        ArgumentResolverRegistry registry = new ArgumentResolverRegistry();
        InjectArgumentResolver injectResolver = new InjectArgumentResolver();
        ConfigurationArgumentResolver configurationResolver = new ConfigurationArgumentResolver();

        // Act
        registry.registerResolver(Inject.class, injectResolver, 50);
        registry.registerResolver(OptionalDependency.class, injectResolver, 50);
        registry.registerResolver(InjectConfiguration.class, configurationResolver, 100);

        // Assert
        assertThat(registry.getAllResolvers()).containsExactly(configurationResolver, injectResolver);
    }
}
