package io.eidos.backend.c;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** Architecture guardrails for the C backend module. */
@AnalyzeClasses(
        packages = "io.eidos.backend.c",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CBackendArchitectureTest {

    @ArchTest
    static final ArchRule onlyCoreSpiAndModel = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.eidos.core.engine..", "io.eidos.core.spec..", "io.eidos.cli..", "io.eidos.backend.python..")
            .because("backends see the core only through the SPI and the syntax-tree model");

    @ArchTest
    static final ArchRule adapterAndHookAreStateless = classes()
            .should()
            .haveOnlyFinalFields()
            .because("declaration state belongs in the per-render RenderContext");
}
