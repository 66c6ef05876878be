/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.sweep.simplify;

import java.util.Arrays;
import java.util.Collections;

import exm.sweep.simplify.CleanupProfile.CallShape;
import exm.sweep.simplify.CleanupProfile.ConditionalShape;
import exm.sweep.simplify.CleanupProfile.DeclarationShape;
import exm.sweep.simplify.CleanupProfile.LiteralShape;
import exm.sweep.simplify.CleanupProfile.OperatorShape;

/**
 * A C-like profile for simplifier tests
 */
class CLikeProfile {

  static CleanupProfile create() {
    return new CleanupProfile.Builder("c-like")
        .booleans(new LiteralShape("true", "true"),
                  new LiteralShape("false", "false"))
        .literalKinds(Arrays.asList("int_literal"))
        .and(new OperatorShape("binary_expression", "&&"))
        .or(new OperatorShape("binary_expression", "||"))
        .not(new OperatorShape("unary_expression", "!"))
        .parenthesisKinds(Arrays.asList("parenthesized_expression"))
        .conditional(new ConditionalShape("if_statement", "condition",
                                          "consequence", "alternative"))
        .ternary(new ConditionalShape("conditional_expression", "condition",
                                      "consequence", "alternative"))
        .elseClauseKind("else_clause")
        .blockKinds(Arrays.asList("block"))
        .terminatorKinds(Arrays.asList("return_statement"))
        .declaration(new DeclarationShape("short_var_declaration", "left",
                                          "right"))
        .identifierKind("identifier")
        .call(new CallShape("call_expression", "function"))
        .pureCalls(Collections.singletonList("isReady"))
        .pureKinds(Arrays.asList("expression_list", "argument_list"))
        .delimiterKinds(Arrays.asList("{", "}", "else", "lparen", "rparen"))
        .build();
  }
}
