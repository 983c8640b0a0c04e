/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowsmith.dsl;

import dev.mars.flowsmith.contract.PromptContract;
import dev.mars.flowsmith.core.Diagnostics;
import dev.mars.flowsmith.dsl.ast.AstBuilder;
import dev.mars.flowsmith.dsl.ast.DocumentNode;
import dev.mars.flowsmith.dsl.ast.ParseResult;
import dev.mars.flowsmith.dsl.lexer.DslLexer;
import dev.mars.flowsmith.dsl.lexer.Token;
import dev.mars.flowsmith.dsl.lexer.TokenizeResult;
import dev.mars.flowsmith.dsl.transform.ContractTransformer;
import dev.mars.flowsmith.dsl.transform.TransformResult;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Entry point for compiling prompt documents into {@link PromptContract}s.
 * <p>
 * Runs lexer, AST builder and contract transformer in sequence, or the heuristic reader followed
 * by the transformer when {@link CompileMode#HEURISTIC} is selected. Each call works on its own
 * values, so one compiler may serve concurrent callers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class DslCompiler {

    private static final Logger logger = Logger.getLogger(DslCompiler.class.getName());

    private final DslLexer lexer;
    private final AstBuilder astBuilder;
    private final ContractTransformer transformer;
    private final HeuristicAstReader heuristicReader;

    public DslCompiler() {
        this(new DslLexer(), new AstBuilder(), new ContractTransformer(), new HeuristicAstReader());
    }

    public DslCompiler(DslLexer lexer, AstBuilder astBuilder, ContractTransformer transformer,
                       HeuristicAstReader heuristicReader) {
        this.lexer = Objects.requireNonNull(lexer, "Lexer cannot be null");
        this.astBuilder = Objects.requireNonNull(astBuilder, "AST builder cannot be null");
        this.transformer = Objects.requireNonNull(transformer, "Transformer cannot be null");
        this.heuristicReader = Objects.requireNonNull(heuristicReader, "Heuristic reader cannot be null");
    }

    public TokenizeResult tokenize(String text, CompilerOptions options) {
        return lexer.tokenize(text, options);
    }

    public ParseResult parseToAst(List<Token> tokens, CompilerOptions options) {
        return astBuilder.parseToAst(tokens, options);
    }

    public TransformResult transformToContract(DocumentNode ast, CompilerOptions options) {
        return transformer.transformToContract(ast, options);
    }

    public CompileResult compile(String text) {
        return compile(text, CompilerOptions.defaults());
    }

    public CompileResult compile(String text, CompilerOptions options) {
        Objects.requireNonNull(text, "Text cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        long start = System.nanoTime();

        Diagnostics diagnostics = new Diagnostics(options.getMaxErrors());
        ParseResult parsed;
        if (options.getMode() == CompileMode.HEURISTIC) {
            parsed = heuristicReader.read(text, options);
        } else {
            TokenizeResult tokens = lexer.tokenize(text, options);
            diagnostics.addAll(tokens.errors());
            diagnostics.addAll(tokens.warnings());
            parsed = astBuilder.parseToAst(tokens.tokens(), options);
        }
        diagnostics.addAll(parsed.errors());
        diagnostics.addAll(parsed.warnings());

        PromptContract contract = null;
        if (parsed.ast().isPresent()) {
            TransformResult transformed = transformer.transformToContract(parsed.ast().get(), options);
            diagnostics.addAll(transformed.errors());
            diagnostics.addAll(transformed.warnings());
            contract = transformed.contract().orElse(null);
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        CompileResult result = new CompileResult(contract, diagnostics.getErrors(), diagnostics.getWarnings(), elapsedMs);
        if (result.isSuccess()) {
            logger.info("Compiled prompt into contract with " + contract.getSteps().size() + " steps ("
                    + result.getWarnings().size() + " warnings, " + elapsedMs + "ms)");
        } else {
            logger.info("Prompt compilation failed with " + result.getErrors().size() + " errors");
        }
        return result;
    }

    /**
     * Compiles and returns the contract, raising the collected errors as an exception on failure.
     */
    public PromptContract compileOrThrow(String text, CompilerOptions options) throws DslCompileException {
        CompileResult result = compile(text, options);
        return result.getContract().orElseThrow(() -> new DslCompileException(result.getErrors()));
    }
}
