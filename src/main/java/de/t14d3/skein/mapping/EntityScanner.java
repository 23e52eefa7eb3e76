package de.t14d3.skein.mapping;

import de.t14d3.skein.annotations.Entity;
import de.t14d3.skein.schema.Schema;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

public class EntityScanner {
    /**
     * Scans the classpath for all @Entity types under the base package and describes them.
     * Requires 'org.reflections:reflections' on the classpath.
     */
    public static Schema scan(String basePackage) {
        return scan(basePackage, new EntityDescriber());
    }

    public static Schema scan(String basePackage, TypeDescriber describer) {
        Reflections reflections = new Reflections(
                new ConfigurationBuilder()
                        .setUrls(ClasspathHelper.forPackage(basePackage))
                        .filterInputsBy(new FilterBuilder().includePackage(basePackage))
                        .setScanners(Scanners.TypesAnnotated)
        );
        Set<Class<?>> entities = reflections.getTypesAnnotatedWith(Entity.class);
        List<Class<?>> annotated = new ArrayList<>();
        for (Class<?> cls : entities) {
            // subclasses of entities are reported as well
            if (cls.isAnnotationPresent(Entity.class)) {
                annotated.add(cls);
            }
        }
        return describer.describeAll(annotated);
    }

    /**
     * Describes the given entity classes.
     */
    public static Schema schemaOf(Class<?>... entityClasses) {
        List<Class<?>> classes = Arrays.asList(entityClasses);
        return new EntityDescriber().describeAll(classes);
    }
}
