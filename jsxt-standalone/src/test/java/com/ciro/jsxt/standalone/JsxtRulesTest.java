package com.ciro.jsxt.standalone;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.ciro.jsxt.JsxException;
import com.ciro.jsxt.ast.JsxVisitor;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;
import com.tngtech.archunit.library.GeneralCodingRules;

@AnalyzeClasses(packages = "com.ciro.jsxt", importOptions = ImportOption.DoNotIncludeTests.class)
public class JsxtRulesTest {

    // 1. El core no conoce al CLI
    @ArchTest
    static final ArchRule core_does_not_depend_on_standalone = noClasses()
            .that().resideInAPackage("com.ciro.jsxt..")
            .and().resideOutsideOfPackage("com.ciro.jsxt.standalone..")
            .should().dependOnClassesThat().resideInAPackage("com.ciro.jsxt.standalone..")
            .because("jsxt-core se usa sin el CLI.");

    // 2. El AST no depende de nada más del proyecto
    @ArchTest
    static final ArchRule ast_is_self_contained = classes()
            .that().resideInAPackage("com.ciro.jsxt.ast..")
            .should().onlyDependOnClassesThat().resideInAnyPackage("com.ciro.jsxt.ast..", "java..")
            .because("Parser, transformer y cualquier otro consumidor comparten el mismo modelo.");

    // 3. Encontrar y parsear JSX no sabe nada de cómo se renderiza
    @ArchTest
    static final ArchRule parsing_does_not_depend_on_rendering = noClasses()
            .that().resideInAnyPackage("com.ciro.jsxt.parser..", "com.ciro.jsxt.scanner..")
            .should().dependOnClassesThat().resideInAPackage("com.ciro.jsxt.template..");

    // 4. Los visitors viven en template (o en el CLI)
    @ArchTest
    static final ArchRule visitors_live_in_consumers = classes()
            .that().implement(JsxVisitor.class)
            .should().resideInAnyPackage("com.ciro.jsxt.template..", "com.ciro.jsxt.standalone..");

    // 5. Sólo se loguea por SLF4J, y el core nunca escribe en consola
    @ArchTest
    static final ArchRule no_java_util_logging = GeneralCodingRules.NO_CLASSES_SHOULD_USE_JAVA_UTIL_LOGGING;

    @ArchTest
    static final ArchRule no_standard_streams = GeneralCodingRules.NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;

    @ArchTest
    static final ArchRule no_logback_in_code = noClasses()
            .should().dependOnClassesThat().resideInAPackage("ch.qos.logback..")
            .because("Logback es sólo el binding del CLI, en runtime.");

    // 6. Las excepciones del core son JsxException o de la JDK
    @ArchTest
    static final ArchRule core_exceptions = classes()
            .that().resideInAPackage("com.ciro.jsxt")
            .and().areAssignableTo(Exception.class)
            .should().beAssignableTo(JsxException.class);
}
