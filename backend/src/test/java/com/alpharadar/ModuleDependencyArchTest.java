package com.alpharadar;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: detection never sees alerting or HTTP, the store never sees detection.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.alpharadar");
    }

    @Test
    void domain_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..trending..", "..liquidity..",
                        "..alert..", "..api..", "..config..", "..metrics..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_trending_alert_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion..")
                .should().dependOnClassesThat().resideInAnyPackage("..trending..", "..alert..", "..api..", "..liquidity..");
        rule.check(classes);
    }

    @Test
    void liquidity_must_not_depend_on_ingestion_trending_alert_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..liquidity..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..trending..", "..alert..", "..api..");
        rule.check(classes);
    }

    @Test
    void trending_must_not_know_about_cooldowns_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..trending..")
                .should().dependOnClassesThat().resideInAnyPackage("..alert..", "..api..");
        rule.check(classes);
    }

    @Test
    void alert_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..alert..")
                .should().dependOnClassesThat().resideInAPackage("..api..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.alpharadar.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }

    @Test
    void ingestion_store_must_not_depend_on_job_triggers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.store..")
                .should().dependOnClassesThat().resideInAPackage("..ingestion.job..");
        rule.check(classes);
    }
}
