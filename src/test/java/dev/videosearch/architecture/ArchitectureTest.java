package dev.videosearch.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.videosearch", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Feature packages should not depend on adapter packages.
    @ArchTest
    static final ArchRule features_should_not_depend_on_adapters =
        noClasses().that().resideInAnyPackage(
                "..clip..", "..embedding..", "..ingestion..", "..media..", "..search..", "..store.."
            )
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api.."
            );

    // Adapter packages should not depend on each other
    @ArchTest
    static final ArchRule adapters_should_not_depend_on_each_other =
        noClasses().that().resideInAPackage("..mcp..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    @ArchTest
    static final ArchRule config_should_not_depend_on_adapters =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..mcp..", "..api.."
            );

    // The store is the lowest layer above the clip model
    @ArchTest
    static final ArchRule store_should_not_depend_on_pipelines =
        noClasses().that().resideInAPackage("..store..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..ingestion..", "..search..", "..embedding..", "..media.."
            );

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.videosearch.(*)..").should().beFreeOfCycles();
}
