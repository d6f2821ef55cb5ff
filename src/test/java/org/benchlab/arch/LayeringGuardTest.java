package org.benchlab.arch;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "org.benchlab", importOptions = ImportOption.DoNotIncludeTests.class)
class LayeringGuardTest {
    @ArchTest
    static final ArchRule core_packages_do_not_depend_on_lifecycle_or_io = noClasses()
            .that()
            .resideInAnyPackage(
                    "org.benchlab.model..",
                    "org.benchlab.stats..",
                    "org.benchlab.metric..",
                    "org.benchlab.aggregate..",
                    "org.benchlab.obs..",
                    "org.benchlab.codec..",
                    "org.benchlab.registry..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "org.benchlab.exec..",
                    "org.benchlab.state..",
                    "org.benchlab.artifact..",
                    "org.benchlab.config..");

    @ArchTest
    static final ArchRule execution_does_not_depend_on_stages_or_artifacts = noClasses()
            .that()
            .resideInAPackage("org.benchlab.exec..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("org.benchlab.state..", "org.benchlab.artifact..");

    @ArchTest
    static final ArchRule stages_do_not_depend_on_artifacts = noClasses()
            .that()
            .resideInAPackage("org.benchlab.state..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("org.benchlab.artifact..", "org.benchlab.config..");
}
