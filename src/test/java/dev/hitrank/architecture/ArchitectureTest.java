package dev.hitrank.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.hitrank", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // The hit list is the core: it knows nothing about how hits are flagged or printed.
    @ArchTest
    static final ArchRule hits_should_not_depend_on_consumers =
        noClasses().that().resideInAPackage("..hits..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..threshold..", "..report..", "..benchmark.."
            );

    // Thresholding flags hits; rendering them is the report package's job
    @ArchTest
    static final ArchRule threshold_should_not_depend_on_report =
        noClasses().that().resideInAPackage("..threshold..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..report..", "..benchmark.."
            );

    @ArchTest
    static final ArchRule report_should_not_depend_on_benchmark =
        noClasses().that().resideInAPackage("..report..")
            .should().dependOnClassesThat().resideInAPackage("..benchmark..");

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.hitrank.(*)..").should().beFreeOfCycles();
}
