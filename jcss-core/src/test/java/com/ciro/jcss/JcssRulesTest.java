package com.ciro.jcss;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.GeneralCodingRules.NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;

@AnalyzeClasses(packages = "com.ciro.jcss", importOptions = ImportOption.DoNotIncludeTests.class)
public class JcssRulesTest {

    // 1. Nada escribe en stdout/stderr, todo va por slf4j
    @ArchTest
    static final ArchRule no_standard_streams = NO_CLASSES_SHOULD_ACCESS_STANDARD_STREAMS;

    // 2. El árbol no conoce a nadie
    @ArchTest
    static final ArchRule ast_is_self_contained = noClasses()
            .that().resideInAPackage("..jcss.ast..")
            .should().dependOnClassesThat().resideInAnyPackage(
                    "..jcss.syntax..", "..jcss.traverse..", "..jcss.extract..", "..jcss.mutate..",
                    "..jcss.synth..", "..jcss.process..", "..jcss.api..")
            .because("El AST es la base de todo lo demás.");

    // 3. ph-css solo valida declaraciones del llamador
    @ArchTest
    static final ArchRule ph_css_only_in_mutators = noClasses()
            .that().resideOutsideOfPackage("..jcss.mutate..")
            .should().dependOnClassesThat().resideInAPackage("com.helger..")
            .because("El parseo estructural es propio; ph-css no conserva comentarios.");

    // 4. Jackson queda en la capa API
    @ArchTest
    static final ArchRule jackson_only_in_api = noClasses()
            .that().resideOutsideOfPackage("..jcss.api..")
            .should().dependOnClassesThat().resideInAPackage("com.fasterxml.jackson..")
            .because("Las operaciones devuelven tipos Java; el JSON es cosa de la API.");

    // 5. Las excepciones de jcss son unchecked y tienen código
    @ArchTest
    static final ArchRule exceptions_extend_root = classes()
            .that().resideInAPackage("..jcss.error..")
            .and().haveSimpleNameEndingWith("Exception")
            .should().beAssignableTo(com.ciro.jcss.error.CssException.class)
            .because("La API traduce CssException#code() al JSON de error.");
}
