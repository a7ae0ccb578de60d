// Copyright 2026 The Bazel Authors. All rights reserved.
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

/** A pretty-printer for Python syntax trees. */
final class NodePrinter {

  private final StringBuilder buf;
  private int indent;

  NodePrinter(StringBuilder buf) {
    this(buf, 0);
  }

  NodePrinter(StringBuilder buf, int indent) {
    this.buf = buf;
    this.indent = indent;
  }

  // Constructs and returns a pretty-printed representation of the node.
  void printNode(Node n) {
    if (n instanceof Expression expr) {
      printExpr(expr);

    } else if (n instanceof Statement stmt) {
      printStmt(stmt);

    } else if (n instanceof SourceFile file) {
      for (Statement stmt : file.getStatements()) {
        printStmt(stmt);
      }

    } else if (n instanceof Argument arg) {
      printArgument(arg);

    } else if (n instanceof Parameter param) {
      printParameter(param);

    } else if (n instanceof Pattern pattern) {
      printPattern(pattern);

    } else if (n instanceof DictExpression.Entry entry) {
      printDictEntry(entry);

    } else if (n instanceof Comprehension.Clause clause) {
      printClause(clause);

    } else if (n instanceof MatchStatement.Case c) {
      printCase(c);

    } else if (n instanceof TryStatement.Handler handler) {
      printHandler(handler);

    } else if (n instanceof WithStatement.Item item) {
      printWithItem(item);

    } else {
      throw new IllegalArgumentException(n.getClass().getName());
    }
  }

  private void printIndent() {
    for (int i = 0; i < indent; i++) {
      buf.append("    ");
    }
  }

  private void printSuite(List<Statement> statements) {
    buf.append(":\n");
    indent++;
    for (Statement stmt : statements) {
      printStmt(stmt);
    }
    indent--;
  }

  private void printArgument(Argument arg) {
    if (arg instanceof Argument.Keyword keyword) {
      buf.append(keyword.getName()).append('=');
    } else if (arg instanceof Argument.Star) {
      buf.append('*');
    } else if (arg instanceof Argument.StarStar) {
      buf.append("**");
    }
    printExpr(arg.getValue());
  }

  private void printParameter(Parameter param) {
    if (param instanceof Parameter.Star) {
      buf.append('*');
    } else if (param instanceof Parameter.StarStar) {
      buf.append("**");
    }
    if (param.getName() != null) {
      buf.append(param.getName());
    }
    if (param.getType() != null) {
      buf.append(": ");
      printExpr(param.getType());
    }
    if (param.getDefaultValue() != null) {
      buf.append('=');
      printExpr(param.getDefaultValue());
    }
  }

  private void printDictEntry(DictExpression.Entry e) {
    if (e.getKey() == null) {
      buf.append("**");
    } else {
      printExpr(e.getKey());
      buf.append(": ");
    }
    printExpr(e.getValue());
  }

  private void printClause(Comprehension.Clause clause) {
    if (clause instanceof Comprehension.For forClause) {
      buf.append("for ");
      printExpr(forClause.getVars());
      buf.append(" in ");
      printExpr(forClause.getIterable());
    } else {
      buf.append("if ");
      printExpr(((Comprehension.If) clause).getCondition());
    }
  }

  private void printCase(MatchStatement.Case c) {
    printIndent();
    buf.append("case ");
    printPattern(c.getPattern());
    if (c.getGuard() != null) {
      buf.append(" if ");
      printExpr(c.getGuard());
    }
    printSuite(c.getBody());
  }

  private void printHandler(TryStatement.Handler handler) {
    printIndent();
    buf.append("except");
    if (handler.getType() != null) {
      buf.append(' ');
      printExpr(handler.getType());
      if (handler.getName() != null) {
        buf.append(" as ").append(handler.getName().getName());
      }
    }
    printSuite(handler.getBody());
  }

  private void printWithItem(WithStatement.Item item) {
    printExpr(item.getContext());
    if (item.getTarget() != null) {
      buf.append(" as ");
      printExpr(item.getTarget());
    }
  }

  private void printElse(List<Statement> elseBlock) {
    if (!elseBlock.isEmpty()) {
      printIndent();
      buf.append("else");
      printSuite(elseBlock);
    }
  }

  private void printStmt(Statement s) {
    printIndent();

    switch (s.kind()) {
      case ASSERT:
        {
          AssertStatement stmt = (AssertStatement) s;
          buf.append("assert ");
          printExpr(stmt.getCondition());
          if (stmt.getMessage() != null) {
            buf.append(", ");
            printExpr(stmt.getMessage());
          }
          buf.append('\n');
          break;
        }

      case ASSIGNMENT:
        {
          AssignmentStatement stmt = (AssignmentStatement) s;
          if (stmt.getType() != null) {
            printExpr(stmt.getLHS());
            buf.append(": ");
            printExpr(stmt.getType());
            if (stmt.getRHS() != null) {
              buf.append(" = ");
              printExpr(stmt.getRHS());
            }
          } else {
            for (Expression target : stmt.getTargets()) {
              printExpr(target);
              buf.append(' ');
              if (stmt.isAugmented()) {
                buf.append(stmt.getOperator());
              }
              buf.append("= ");
            }
            printExpr(stmt.getRHS());
          }
          buf.append('\n');
          break;
        }

      case CLASS:
        {
          ClassStatement stmt = (ClassStatement) s;
          printDecorators(stmt.getDecorators());
          buf.append("class ").append(stmt.getIdentifier().getName());
          if (!stmt.getBases().isEmpty()) {
            buf.append('(');
            printList(stmt.getBases());
            buf.append(')');
          }
          printSuite(stmt.getBody());
          break;
        }

      case DEF:
        {
          DefStatement stmt = (DefStatement) s;
          printDecorators(stmt.getDecorators());
          if (stmt.isAsync()) {
            buf.append("async ");
          }
          buf.append("def ").append(stmt.getName()).append('(');
          printList(stmt.getParameters());
          buf.append(')');
          if (stmt.getReturnType() != null) {
            buf.append(" -> ");
            printExpr(stmt.getReturnType());
          }
          printSuite(stmt.getBody());
          break;
        }

      case DEL:
        {
          buf.append("del ");
          printList(((DelStatement) s).getTargets());
          buf.append('\n');
          break;
        }

      case EXPRESSION:
        {
          printExpr(((ExpressionStatement) s).getExpression());
          buf.append('\n');
          break;
        }

      case FLOW:
        {
          buf.append(((FlowStatement) s).getFlowKind()).append('\n');
          break;
        }

      case FOR:
        {
          ForStatement stmt = (ForStatement) s;
          buf.append("for ");
          printExpr(stmt.getVars());
          buf.append(" in ");
          printExpr(stmt.getIterable());
          printSuite(stmt.getBody());
          printElse(stmt.getElseBlock());
          break;
        }

      case GLOBAL:
        {
          GlobalStatement stmt = (GlobalStatement) s;
          buf.append(stmt.isNonlocal() ? "nonlocal " : "global ");
          printList(stmt.getNames());
          buf.append('\n');
          break;
        }

      case IF:
        {
          IfStatement stmt = (IfStatement) s;
          buf.append(stmt.isElif() ? "elif " : "if ");
          printExpr(stmt.getCondition());
          printSuite(stmt.getThenBlock());
          List<Statement> elseBlock = stmt.getElseBlock();
          if (elseBlock != null) {
            if (elseBlock.size() == 1
                && elseBlock.get(0) instanceof IfStatement elif
                && elif.isElif()) {
              printStmt(elif);
            } else {
              printElse(elseBlock);
            }
          }
          break;
        }

      case IMPORT:
        {
          ImportStatement stmt = (ImportStatement) s;
          if (stmt.getModule() != null) {
            buf.append("from ").append(stmt.getModule()).append(' ');
          }
          buf.append("import ");
          String sep = "";
          for (ImportStatement.Binding binding : stmt.getBindings()) {
            buf.append(sep).append(binding.getName());
            if (binding.getAlias() != null) {
              buf.append(" as ").append(binding.getAlias());
            }
            sep = ", ";
          }
          buf.append('\n');
          break;
        }

      case MATCH:
        {
          MatchStatement stmt = (MatchStatement) s;
          buf.append("match ");
          printExpr(stmt.getSubject());
          buf.append(":\n");
          indent++;
          for (MatchStatement.Case c : stmt.getCases()) {
            printCase(c);
          }
          indent--;
          break;
        }

      case RAISE:
        {
          RaiseStatement stmt = (RaiseStatement) s;
          buf.append("raise");
          if (stmt.getException() != null) {
            buf.append(' ');
            printExpr(stmt.getException());
            if (stmt.getCause() != null) {
              buf.append(" from ");
              printExpr(stmt.getCause());
            }
          }
          buf.append('\n');
          break;
        }

      case RETURN:
        {
          ReturnStatement stmt = (ReturnStatement) s;
          buf.append("return");
          if (stmt.getResult() != null) {
            buf.append(' ');
            printExpr(stmt.getResult());
          }
          buf.append('\n');
          break;
        }

      case TRY:
        {
          TryStatement stmt = (TryStatement) s;
          buf.append("try");
          printSuite(stmt.getBody());
          for (TryStatement.Handler handler : stmt.getHandlers()) {
            printHandler(handler);
          }
          printElse(stmt.getElseBlock());
          if (!stmt.getFinallyBlock().isEmpty()) {
            printIndent();
            buf.append("finally");
            printSuite(stmt.getFinallyBlock());
          }
          break;
        }

      case WHILE:
        {
          WhileStatement stmt = (WhileStatement) s;
          buf.append("while ");
          printExpr(stmt.getCondition());
          printSuite(stmt.getBody());
          printElse(stmt.getElseBlock());
          break;
        }

      case WITH:
        {
          WithStatement stmt = (WithStatement) s;
          buf.append("with ");
          printList(stmt.getItems());
          printSuite(stmt.getBody());
          break;
        }
    }
  }

  private void printDecorators(List<Expression> decorators) {
    for (Expression decorator : decorators) {
      buf.append('@');
      printExpr(decorator);
      buf.append('\n');
      printIndent();
    }
  }

  private void printList(List<? extends Node> list) {
    String sep = "";
    for (Node node : list) {
      buf.append(sep);
      printNode(node);
      sep = ", ";
    }
  }

  private void printPattern(Pattern p) {
    switch (p.kind()) {
      case VALUE:
        printExpr(((Pattern.Value) p).getValue());
        break;

      case AS:
        {
          Pattern.As as = (Pattern.As) p;
          if (as.getPattern() != null) {
            printPattern(as.getPattern());
            buf.append(" as ");
          }
          buf.append(as.getName() == null ? "_" : as.getName().getName());
          break;
        }

      case SEQUENCE:
        buf.append('[');
        printList(((Pattern.Sequence) p).getElements());
        buf.append(']');
        break;

      case STAR:
        {
          Pattern.Star star = (Pattern.Star) p;
          buf.append('*').append(star.getName() == null ? "_" : star.getName().getName());
          break;
        }

      case OR:
        {
          String sep = "";
          for (Pattern alt : ((Pattern.Or) p).getAlternatives()) {
            buf.append(sep);
            printPattern(alt);
            sep = " | ";
          }
          break;
        }

      case CLASS:
        {
          Pattern.ClassPattern cls = (Pattern.ClassPattern) p;
          printExpr(cls.getCls());
          buf.append('(');
          String sep = "";
          for (Pattern arg : cls.getPositional()) {
            buf.append(sep);
            printPattern(arg);
            sep = ", ";
          }
          for (int i = 0; i < cls.getKeywordNames().size(); i++) {
            buf.append(sep).append(cls.getKeywordNames().get(i).getName()).append('=');
            printPattern(cls.getKeywordPatterns().get(i));
            sep = ", ";
          }
          buf.append(')');
          break;
        }

      case MAPPING:
        {
          Pattern.Mapping mapping = (Pattern.Mapping) p;
          buf.append('{');
          String sep = "";
          for (int i = 0; i < mapping.getKeys().size(); i++) {
            buf.append(sep);
            printExpr(mapping.getKeys().get(i));
            buf.append(": ");
            printPattern(mapping.getValues().get(i));
            sep = ", ";
          }
          if (mapping.getRest() != null) {
            buf.append(sep).append("**").append(mapping.getRest().getName());
          }
          buf.append('}');
          break;
        }
    }
  }

  private void printExpr(Expression expr) {
    switch (expr.kind()) {
      case AWAIT:
        buf.append("await ");
        printExpr(((AwaitExpression) expr).getValue());
        break;

      case BINARY_OPERATOR:
        {
          BinaryOperatorExpression binop = (BinaryOperatorExpression) expr;
          buf.append('(');
          printExpr(binop.getX());
          buf.append(' ').append(binop.getOperator()).append(' ');
          printExpr(binop.getY());
          buf.append(')');
          break;
        }

      case CALL:
        {
          CallExpression call = (CallExpression) expr;
          printExpr(call.getFunction());
          buf.append('(');
          printList(call.getArguments());
          buf.append(')');
          break;
        }

      case CHAINED_COMPARISON:
        {
          ChainedComparison chain = (ChainedComparison) expr;
          buf.append('(');
          printExpr(chain.getOperands().get(0));
          for (int i = 0; i < chain.getOperators().size(); i++) {
            buf.append(' ').append(chain.getOperators().get(i)).append(' ');
            printExpr(chain.getOperands().get(i + 1));
          }
          buf.append(')');
          break;
        }

      case COMPREHENSION:
        {
          Comprehension comp = (Comprehension) expr;
          String open;
          String close;
          switch (comp.getShape()) {
            case LIST -> {
              open = "[";
              close = "]";
            }
            case GENERATOR -> {
              open = "(";
              close = ")";
            }
            default -> {
              open = "{";
              close = "}";
            }
          }
          buf.append(open);
          printNode(comp.getBody());
          for (Comprehension.Clause clause : comp.getClauses()) {
            buf.append(' ');
            printClause(clause);
          }
          buf.append(close);
          break;
        }

      case CONDITIONAL:
        {
          ConditionalExpression cond = (ConditionalExpression) expr;
          printExpr(cond.getThenCase());
          buf.append(" if ");
          printExpr(cond.getCondition());
          buf.append(" else ");
          printExpr(cond.getElseCase());
          break;
        }

      case DICT_EXPR:
        buf.append('{');
        printList(((DictExpression) expr).getEntries());
        buf.append('}');
        break;

      case DOT:
        {
          DotExpression dot = (DotExpression) expr;
          printExpr(dot.getObject());
          buf.append('.').append(dot.getField().getName());
          break;
        }

      case ELLIPSIS:
        buf.append("...");
        break;

      case FLOAT_LITERAL:
        buf.append(((FloatLiteral) expr).getRaw());
        break;

      case IDENTIFIER:
        buf.append(((Identifier) expr).getName());
        break;

      case INDEX:
        {
          IndexExpression index = (IndexExpression) expr;
          printExpr(index.getObject());
          buf.append('[');
          printExpr(index.getKey());
          buf.append(']');
          break;
        }

      case INT_LITERAL:
        buf.append(((IntLiteral) expr).getRaw());
        break;

      case LAMBDA:
        {
          LambdaExpression lambda = (LambdaExpression) expr;
          buf.append("lambda");
          if (!lambda.getParameters().isEmpty()) {
            buf.append(' ');
            printList(lambda.getParameters());
          }
          buf.append(": ");
          printExpr(lambda.getBody());
          break;
        }

      case LIST_EXPR:
        {
          ListExpression list = (ListExpression) expr;
          switch (list.getShape()) {
            case LIST -> buf.append('[');
            case TUPLE -> buf.append('(');
            case SET -> buf.append('{');
          }
          printList(list.getElements());
          switch (list.getShape()) {
            case LIST -> buf.append(']');
            case TUPLE -> buf.append(list.getElements().size() == 1 ? ",)" : ")");
            case SET -> buf.append('}');
          }
          break;
        }

      case SLICE:
        {
          SliceExpression slice = (SliceExpression) expr;
          printExpr(slice.getObject());
          buf.append('[');
          if (slice.getStart() != null) {
            printExpr(slice.getStart());
          }
          buf.append(':');
          if (slice.getStop() != null) {
            printExpr(slice.getStop());
          }
          if (slice.getStep() != null) {
            buf.append(':');
            printExpr(slice.getStep());
          }
          buf.append(']');
          break;
        }

      case STARRED:
        buf.append('*');
        printExpr(((StarredExpression) expr).getValue());
        break;

      case STRING_LITERAL:
        printStringLiteral(((StringLiteral) expr).getValue());
        break;

      case UNARY_OPERATOR:
        {
          UnaryOperatorExpression unop = (UnaryOperatorExpression) expr;
          buf.append('(');
          buf.append(unop.getOperator());
          if (unop.getOperator() == TokenKind.NOT) {
            buf.append(' ');
          }
          printExpr(unop.getX());
          buf.append(')');
          break;
        }

      case YIELD:
        {
          YieldExpression yield = (YieldExpression) expr;
          buf.append(yield.isFrom() ? "yield from" : "yield");
          if (yield.getValue() != null) {
            buf.append(' ');
            printExpr(yield.getValue());
          }
          break;
        }
    }
  }

  private void printStringLiteral(String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"' -> buf.append("\\\"");
        case '\\' -> buf.append("\\\\");
        case '\n' -> buf.append("\\n");
        case '\r' -> buf.append("\\r");
        case '\t' -> buf.append("\\t");
        default -> buf.append(c);
      }
    }
    buf.append('"');
  }
}
