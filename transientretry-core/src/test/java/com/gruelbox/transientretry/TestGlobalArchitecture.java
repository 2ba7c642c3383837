package com.gruelbox.transientretry;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.gruelbox.transientretry.spi.Utils;
import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import org.junit.jupiter.api.Test;

class TestGlobalArchitecture {

  private static final JavaClasses all =
      new ClassFileImporter()
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
          .importPackagesOf(RetryPolicy.class);

  @Test
  void no_logging_backend_access() {
    noClasses()
        .that()
        .resideInAPackage(RetryPolicy.class.getPackageName() + "..")
        .should()
        .accessClassesThat()
        .resideInAPackage("ch.qos.logback..")
        .check(all);
  }

  @Test
  void no_spi_access_to_policies() {
    noClasses()
        .that()
        .resideInAPackage(Utils.class.getPackageName())
        .should()
        .dependOnClassesThat()
        .areAssignableTo(RetryPolicy.class)
        .check(all);
  }
}
