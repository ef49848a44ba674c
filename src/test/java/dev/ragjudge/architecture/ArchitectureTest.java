package dev.ragjudge.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.ragjudge", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // The judge only talks to the provider; scoring logic lives above it.
    @ArchTest
    static final ArchRule judge_should_not_depend_on_scoring =
        noClasses().that().resideInAPackage("..judge..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..evaluator..", "..runner..", "..generator..", "..config.."
            );

    // Evaluators score single test cases and know nothing about batches
    @ArchTest
    static final ArchRule evaluators_should_not_depend_on_runner =
        noClasses().that().resideInAPackage("..evaluator..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..runner..", "..generator..", "..config.."
            );

    // The data model is shared by every layer and depends on none of them
    @ArchTest
    static final ArchRule testcase_should_be_standalone =
        noClasses().that().resideInAPackage("..testcase..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..judge..", "..evaluator..", "..runner..", "..generator..", "..config.."
            );

    // Only the config package wires beans together
    @ArchTest
    static final ArchRule features_should_not_depend_on_config =
        noClasses().that().resideInAnyPackage(
                "..runner..", "..generator..", "..concurrent.."
            )
            .should().dependOnClassesThat().resideInAPackage("..config..");

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.ragjudge.(*)..").should().beFreeOfCycles();
}
