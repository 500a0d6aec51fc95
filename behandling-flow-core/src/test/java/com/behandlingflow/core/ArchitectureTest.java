package com.behandlingflow.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Flow analysis does not know about diagram output</li>
 *   <li>Base extractors don't depend on implementations</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.behandlingflow.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..index..", "..flow..", "..cycle..", "..consolidate..",
                "..extractor..", "..generator..", "..renderer..", "..engine..");

        rule.check(classes);
    }

    /**
     * Verifies the analysis packages never reach into diagram generation, fact extraction or output.
     */
    @Test
    void analysis_shouldNotDependOnOutput() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..index..", "..flow..", "..cycle..", "..consolidate..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..extractor..", "..generator..", "..renderer..", "..engine..", "..config..");

        rule.check(classes);
    }

    @Test
    void baseExtractors_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..extractor.base..")
            .should().dependOnClassesThat().resideInAPackage("..extractor.impl..");

        rule.check(classes);
    }

    @Test
    void extractors_shouldExtendAbstractFactExtractor() {
        ArchRule rule = classes()
            .that().resideInAPackage("..extractor.impl..")
            .and().haveSimpleNameEndingWith("Extractor")
            .should().beAssignableTo("com.behandlingflow.core.extractor.base.AbstractFactExtractor");

        rule.check(classes);
    }

    @Test
    void generators_shouldImplementDiagramGenerator() {
        ArchRule rule = classes()
            .that().resideInAPackage("..generator.impl..")
            .and().haveSimpleNameEndingWith("Generator")
            .should().implement("com.behandlingflow.core.generator.DiagramGenerator");

        rule.check(classes);
    }
}
