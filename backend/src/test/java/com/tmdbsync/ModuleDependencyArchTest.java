package com.tmdbsync;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: shared primitives at the bottom, the engine and its wiring on top.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.tmdbsync");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.tmdbsync.common..")
                .should().dependOnClassesThat().resideInAnyPackage("com.tmdbsync.domain..", "com.tmdbsync.ingestion..", "com.tmdbsync.config..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.tmdbsync.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("com.tmdbsync.ingestion..", "com.tmdbsync.config..");
        rule.check(classes);
    }

    @Test
    void client_must_not_depend_on_stores_or_jobs() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.client..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.store..", "..ingestion.job..", "..ingestion.catalog..");
        rule.check(classes);
    }

    @Test
    void store_must_not_depend_on_client_or_jobs() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.store..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.client..", "..ingestion.job..", "..ingestion.catalog..");
        rule.check(classes);
    }

    @Test
    void projection_must_not_depend_on_io_layers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.projection..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.client..", "..ingestion.store..", "..ingestion.job..", "..ingestion.catalog..");
        rule.check(classes);
    }

    @Test
    void catalog_must_not_depend_on_job_triggers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.catalog..")
                .should().dependOnClassesThat().resideInAPackage("..ingestion.job..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.tmdbsync.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
