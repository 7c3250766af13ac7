package com.purchasingpower.codelod.parser.impl;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.purchasingpower.codelod.core.CodeLocation;
import com.purchasingpower.codelod.core.CodeLodPaths;
import com.purchasingpower.codelod.core.ParsedEntity;
import com.purchasingpower.codelod.core.Scope;
import com.purchasingpower.codelod.fingerprint.FingerprintService;
import com.purchasingpower.codelod.parser.CodeParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JavaParser based extraction of modules, types, methods and constructors.
 *
 * <p>Entity source is the full lines the declaration spans, annotations included,
 * preceding Javadoc excluded. Overloaded members are told apart by their parameter types.
 *
 * @since 0.1.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JavaSourceParser implements CodeParser {

    private static final String LANGUAGE = "java";

    private final FingerprintService fingerprintService;
    private final CodeLodPaths paths;

    @Override
    public String language() {
        return LANGUAGE;
    }

    @Override
    public boolean supports(Path file) {
        return file.getFileName() != null && file.getFileName().toString().endsWith(".java");
    }

    @Override
    public List<ParsedEntity> parseFile(Path file) {
        log.debug("📄 Parsing Java file: {}", file);
        String source;
        try {
            source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("⚠️ Cannot read {}: {}", file, e.getMessage());
            return List.of();
        }

        // A fresh parser per call: JavaParser instances are not thread safe
        JavaParser parser = new JavaParser(new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.warn("⚠️ Failed to parse {}: {}", file, result.getProblems().stream()
                .map(Problem::getMessage)
                .findFirst()
                .orElse("unknown problem"));
            return List.of();
        }
        CompilationUnit cu = result.getResult().get();

        String relativePath = paths.relativize(file);
        String[] lines = source.split("\r\n|\r|\n", -1);
        List<ParsedEntity> entities = new ArrayList<>();

        entities.add(ParsedEntity.builder()
            .scope(Scope.MODULE)
            .name(relativePath)
            .location(new CodeLocation(relativePath, 1, Math.max(1, lines.length)))
            .source(source)
            .fingerprint(fingerprintService.fingerprint(source, LANGUAGE))
            .language(LANGUAGE)
            .build());

        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            if (!type.isTopLevelType() && !type.isNestedType()) {
                continue;
            }
            String typeName = qualifiedName(type);
            String parentName = type.isNestedType()
                ? typeName.substring(0, typeName.lastIndexOf('.'))
                : null;
            entities.add(entity(Scope.CLASS, typeName, parentName, type, lines, relativePath));

            List<CallableDeclaration<?>> callables = new ArrayList<>();
            for (BodyDeclaration<?> member : type.getMembers()) {
                if (member.isCallableDeclaration()) {
                    callables.add(member.asCallableDeclaration());
                }
            }
            Map<String, Long> overloads = callables.stream()
                .collect(Collectors.groupingBy(CallableDeclaration::getNameAsString, HashMap::new, Collectors.counting()));
            for (CallableDeclaration<?> callable : callables) {
                String memberName = overloads.get(callable.getNameAsString()) > 1
                    ? callable.getNameAsString() + "(" + parameterTypes(callable) + ")"
                    : callable.getNameAsString();
                entities.add(entity(Scope.FUNCTION, typeName + "." + memberName, typeName,
                    callable, lines, relativePath));
            }
        }

        log.debug("✅ Parsed {}: {} entities", relativePath, entities.size());
        return entities;
    }

    private ParsedEntity entity(Scope scope, String name, String parentName, Node node,
                                String[] lines, String relativePath) {
        int start = node.getBegin().map(pos -> pos.line).orElse(1);
        int end = node.getEnd().map(pos -> pos.line).orElse(start);
        String text = slice(lines, start, end);
        return ParsedEntity.builder()
            .scope(scope)
            .name(name)
            .parentName(parentName)
            .location(new CodeLocation(relativePath, start, end))
            .source(text)
            .fingerprint(fingerprintService.fingerprint(text, LANGUAGE))
            .language(LANGUAGE)
            .build();
    }

    private static String slice(String[] lines, int start, int end) {
        int from = Math.max(0, start - 1);
        int to = Math.min(lines.length, end);
        return String.join("\n", Arrays.asList(lines).subList(from, to));
    }

    private static String qualifiedName(TypeDeclaration<?> type) {
        Deque<String> parts = new ArrayDeque<>();
        Node current = type;
        while (current != null) {
            if (current instanceof TypeDeclaration) {
                parts.addFirst(((TypeDeclaration<?>) current).getNameAsString());
            }
            current = current.getParentNode().orElse(null);
        }
        return String.join(".", parts);
    }

    private static String parameterTypes(CallableDeclaration<?> callable) {
        return callable.getParameters().stream()
            .map(p -> p.getType().asString() + (p.isVarArgs() ? "..." : ""))
            .collect(Collectors.joining(","));
    }
}
