package de.t14d3.auditlog.mapping;

import de.t14d3.auditlog.annotations.Entity;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Set;

public class EntityScanner {
    /**
     * Scans the classpath for all @Entity types under the base package and preloads their metadata.
     * Requires 'org.reflections:reflections' on the classpath.
     *
     * @param basePackage package to scan, sub-packages included
     * @return the entity classes found, ordered by name
     */
    public static Set<Class<?>> scan(String basePackage) {
        if (basePackage == null || basePackage.isBlank()) {
            throw new IllegalArgumentException("basePackage must not be blank");
        }

        Reflections reflections = new Reflections(
                new ConfigurationBuilder()
                        .setUrls(ClasspathHelper.forPackage(basePackage))
                        .filterInputsBy(new FilterBuilder().includePackage(basePackage))
                        .setScanners(Scanners.TypesAnnotated, Scanners.SubTypes)
        );

        Set<Class<?>> entities = new LinkedHashSet<>();
        reflections.getTypesAnnotatedWith(Entity.class).stream()
                .filter(cls -> cls.isAnnotationPresent(Entity.class))
                .filter(cls -> cls.getName().startsWith(basePackage + "."))
                .sorted(Comparator.comparing(Class::getName))
                .forEach(cls -> {
                    EntityMetadata.of(cls);
                    entities.add(cls);
                });
        return entities;
    }
}
