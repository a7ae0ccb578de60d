// Copyright 2014 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.djls.java.syntax;

import java.util.List;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order (not evaluation order!).
 *
 * <p>Typical usage is for a subclass to just override the {@code visit()} method overloads for the
 * nodes that are relevant to its business logic, and to rely on the default implementations in this
 * class to ensure traversal over the remaining node types. Overriding implementations should
 * remember to traverse children using either {@code super.visit()} on the current node, or explicit
 * calls to {@link #visit(Node)}, {@link #visitAll}, or {@link #visitBlock} on child fields.
 *
 * <p>Type annotations are not visited.
 */
public class NodeVisitor {

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  // ==== Miscellaneous node types ====

  /**
   * Handles all four Argument node types uniformly. Subclasses should not add an overload for a
   * concrete Argument subclass; it won't be called.
   */
  public void visit(Argument node) {
    if (node instanceof Argument.Keyword keyword) {
      visit(keyword.getIdentifier());
    }
    visit(node.getValue());
  }

  /**
   * Handles all four Parameter node types uniformly. Subclasses should not add an overload for a
   * concrete Parameter subclass; it won't be called.
   */
  public void visit(Parameter node) {
    if (node.getIdentifier() != null) {
      visit(node.getIdentifier());
    }
    if (node.getDefaultValue() != null) {
      visit(node.getDefaultValue());
    }
  }

  /** Handles all Pattern node types; dispatch on {@link Pattern#kind} to tell them apart. */
  public void visit(Pattern node) {
    switch (node.kind()) {
      case VALUE -> visit(((Pattern.Value) node).getValue());
      case AS -> {
        Pattern.As as = (Pattern.As) node;
        if (as.getPattern() != null) {
          visit(as.getPattern());
        }
        if (as.getName() != null) {
          visit(as.getName());
        }
      }
      case SEQUENCE -> visitAll(((Pattern.Sequence) node).getElements());
      case STAR -> {
        Pattern.Star star = (Pattern.Star) node;
        if (star.getName() != null) {
          visit(star.getName());
        }
      }
      case OR -> visitAll(((Pattern.Or) node).getAlternatives());
      case CLASS -> {
        Pattern.ClassPattern cls = (Pattern.ClassPattern) node;
        visit(cls.getCls());
        visitAll(cls.getPositional());
        visitAll(cls.getKeywordPatterns());
      }
      case MAPPING -> {
        Pattern.Mapping mapping = (Pattern.Mapping) node;
        visitAll(mapping.getKeys());
        visitAll(mapping.getValues());
        if (mapping.getRest() != null) {
          visit(mapping.getRest());
        }
      }
    }
  }

  public void visit(SourceFile node) {
    visitBlock(node.getStatements());
  }

  // ==== Statement nodes ====

  public void visit(AssertStatement node) {
    visit(node.getCondition());
    if (node.getMessage() != null) {
      visit(node.getMessage());
    }
  }

  public void visit(AssignmentStatement node) {
    visitAll(node.getTargets());
    if (node.getRHS() != null) {
      visit(node.getRHS());
    }
  }

  public void visit(ClassStatement node) {
    visitAll(node.getDecorators());
    visit(node.getIdentifier());
    visitAll(node.getBases());
    visitBlock(node.getBody());
  }

  public void visit(DefStatement node) {
    visitAll(node.getDecorators());
    visit(node.getIdentifier());
    visitAll(node.getParameters());
    visitBlock(node.getBody());
  }

  public void visit(DelStatement node) {
    visitAll(node.getTargets());
  }

  public void visit(ExpressionStatement node) {
    visit(node.getExpression());
  }

  public void visit(FlowStatement node) {}

  public void visit(ForStatement node) {
    visit(node.getVars());
    visit(node.getIterable());
    visitBlock(node.getBody());
    visitBlock(node.getElseBlock());
  }

  public void visit(GlobalStatement node) {
    visitAll(node.getNames());
  }

  public void visit(IfStatement node) {
    visit(node.getCondition());
    visitBlock(node.getThenBlock());
    if (node.getElseBlock() != null) {
      visitBlock(node.getElseBlock());
    }
  }

  public void visit(ImportStatement node) {}

  public void visit(MatchStatement node) {
    visit(node.getSubject());
    visitAll(node.getCases());
  }

  public void visit(MatchStatement.Case node) {
    visit(node.getPattern());
    if (node.getGuard() != null) {
      visit(node.getGuard());
    }
    visitBlock(node.getBody());
  }

  public void visit(RaiseStatement node) {
    if (node.getException() != null) {
      visit(node.getException());
    }
    if (node.getCause() != null) {
      visit(node.getCause());
    }
  }

  public void visit(ReturnStatement node) {
    if (node.getResult() != null) {
      visit(node.getResult());
    }
  }

  public void visit(TryStatement node) {
    visitBlock(node.getBody());
    visitAll(node.getHandlers());
    visitBlock(node.getElseBlock());
    visitBlock(node.getFinallyBlock());
  }

  public void visit(TryStatement.Handler node) {
    if (node.getType() != null) {
      visit(node.getType());
    }
    if (node.getName() != null) {
      visit(node.getName());
    }
    visitBlock(node.getBody());
  }

  public void visit(WhileStatement node) {
    visit(node.getCondition());
    visitBlock(node.getBody());
    visitBlock(node.getElseBlock());
  }

  public void visit(WithStatement node) {
    visitAll(node.getItems());
    visitBlock(node.getBody());
  }

  public void visit(WithStatement.Item node) {
    visit(node.getContext());
    if (node.getTarget() != null) {
      visit(node.getTarget());
    }
  }

  // ==== Expression nodes ====

  public void visit(AwaitExpression node) {
    visit(node.getValue());
  }

  public void visit(BinaryOperatorExpression node) {
    visit(node.getX());
    visit(node.getY());
  }

  public void visit(CallExpression node) {
    visit(node.getFunction());
    visitAll(node.getArguments());
  }

  public void visit(ChainedComparison node) {
    visitAll(node.getOperands());
  }

  public void visit(Comprehension node) {
    visit(node.getBody());
    for (Comprehension.Clause clause : node.getClauses()) {
      if (clause instanceof Comprehension.For) {
        visit((Comprehension.For) clause);
      } else {
        visit((Comprehension.If) clause);
      }
    }
  }

  public void visit(Comprehension.For node) {
    visit(node.getVars());
    visit(node.getIterable());
  }

  public void visit(Comprehension.If node) {
    visit(node.getCondition());
  }

  public void visit(ConditionalExpression node) {
    visit(node.getThenCase());
    visit(node.getCondition());
    if (node.getElseCase() != null) {
      visit(node.getElseCase());
    }
  }

  public void visit(DictExpression node) {
    visitAll(node.getEntries());
  }

  public void visit(DictExpression.Entry node) {
    if (node.getKey() != null) {
      visit(node.getKey());
    }
    visit(node.getValue());
  }

  public void visit(DotExpression node) {
    visit(node.getObject());
  }

  public void visit(Ellipsis node) {}

  public void visit(FloatLiteral node) {}

  public void visit(@SuppressWarnings("unused") Identifier node) {}

  public void visit(IndexExpression node) {
    visit(node.getObject());
    visit(node.getKey());
  }

  public void visit(IntLiteral node) {}

  public void visit(LambdaExpression node) {
    visitAll(node.getParameters());
    visit(node.getBody());
  }

  public void visit(ListExpression node) {
    visitAll(node.getElements());
  }

  public void visit(SliceExpression node) {
    visit(node.getObject());
    if (node.getStart() != null) {
      visit(node.getStart());
    }
    if (node.getStop() != null) {
      visit(node.getStop());
    }
    if (node.getStep() != null) {
      visit(node.getStep());
    }
  }

  public void visit(StarredExpression node) {
    visit(node.getValue());
  }

  public void visit(@SuppressWarnings("unused") StringLiteral node) {}

  public void visit(UnaryOperatorExpression node) {
    visit(node.getX());
  }

  public void visit(YieldExpression node) {
    if (node.getValue() != null) {
      visit(node.getValue());
    }
  }

  // ==== Helpers ====

  /** Visits every node in a list, such as the elements of a list expression. */
  public void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  /**
   * Visits a block of statements, such as the body of a for statement. Subclasses may override
   * this to recognize a block boundary.
   */
  public void visitBlock(List<Statement> statements) {
    visitAll(statements);
  }
}
