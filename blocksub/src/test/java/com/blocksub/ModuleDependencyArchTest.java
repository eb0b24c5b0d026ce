package com.blocksub;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: header sources know nothing about head tracking, and domain/common stay leaf modules.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.blocksub");
    }

    @Test
    void domain_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..head..", "..config..", "..common..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion..", "..head..", "..config..");
        rule.check(classes);
    }

    @Test
    void ingestion_must_not_depend_on_head() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion..")
                .should().dependOnClassesThat().resideInAPackage("..head..");
        rule.check(classes);
    }

    @Test
    void ingestion_adapters_must_not_depend_on_spring_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.adapter..")
                .should().dependOnClassesThat().resideInAPackage("..ingestion.config..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.blocksub.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
