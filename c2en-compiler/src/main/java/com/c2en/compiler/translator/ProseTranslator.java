package com.c2en.compiler.translator;

import com.c2en.compiler.StandardLibrary;
import com.c2en.compiler.ast.AstNode;
import com.c2en.compiler.ast.AstVisitor;
import com.c2en.compiler.ast.decl.*;
import com.c2en.compiler.ast.expr.*;
import com.c2en.compiler.ast.stmt.*;
import com.c2en.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static com.c2en.compiler.translator.ProseText.*;

/**
 * 把 AST 翻译为英文说明文档
 *
 * <p>表达式节点返回短语，语句与声明节点直接写入 {@link TranslationContext} 并返回 null。
 * 函数体顶层语句按顺序编号，嵌套在 if / 循环 / switch 中的语句不编号。
 * 翻译没有错误通道，缺失的子节点以 "nothing" 之类的兜底文本输出。</p>
 */
public class ProseTranslator implements AstVisitor<String, TranslationContext> {
    private static final Logger LOG = Logger.getLogger(ProseTranslator.class.getName());

    /**
     * 翻译程序
     */
    public String translate(Program program, TranslationConfig config) {
        TranslationContext ctx = new TranslationContext(config);
        visitProgram(program, ctx);
        String output = ctx.getOutput();
        LOG.fine(() -> "Rendered " + output.length() + " characters of prose");
        return output;
    }

    /**
     * 使用默认配置翻译
     */
    public String translate(Program program) {
        return translate(program, new TranslationConfig());
    }

    // ============ 辅助方法 ============

    /** 表达式短语，null 表示缺失 */
    private String phrase(Expression expr, TranslationContext ctx, String absent) {
        if (expr == null) {
            return absent;
        }
        String text = expr.accept(this, ctx);
        return text != null ? text : "an expression";
    }

    private String phrase(Expression expr, TranslationContext ctx) {
        return phrase(expr, ctx, "nothing");
    }

    private void statement(Statement stmt, int step, TranslationContext ctx) {
        if (stmt == null) return;
        ctx.setPendingStep(step);
        stmt.accept(this, ctx);
        ctx.setPendingStep(0);
    }

    /**
     * 输出缩进一层的嵌套语句体。代码块展开为其中的语句，均不编号。
     */
    private void nestedBody(Statement body, TranslationContext ctx) {
        ctx.indent();
        if (body instanceof Block) {
            for (Statement stmt : ((Block) body).getStatements()) {
                statement(stmt, 0, ctx);
            }
        } else {
            statement(body, 0, ctx);
        }
        ctx.dedent();
    }

    /** 输出一条语句行，随后空一行 */
    private void sentence(String text, TranslationContext ctx) {
        ctx.line(text);
        ctx.blankLine();
    }

    // ============ 声明 ============

    @Override
    public String visitProgram(Program node, TranslationContext ctx) {
        ctx.line("Programme Description");
        ctx.line(underline("Programme Description", '='));
        ctx.blankLine();

        List<FunctionDecl> functions = node.getFunctionDefinitions();
        ctx.line("This programme consists of " + count(functions.size(), "function", "functions") + ".");
        ctx.blankLine();

        if (ctx.getConfig().isIncludeGlobalDefinitions()) {
            translateGlobalDefinitions(node, ctx);
        }

        for (FunctionDecl function : functions) {
            function.accept(this, ctx);
        }
        return null;
    }

    private void translateGlobalDefinitions(Program node, TranslationContext ctx) {
        List<AstNode> globals = new ArrayList<>();
        for (AstNode decl : node.getDeclarations()) {
            if (!(decl instanceof FunctionDecl)) {
                globals.add(decl);
            }
        }
        if (globals.isEmpty()) return;

        ctx.line("Global Definitions");
        ctx.line(underline("Global Definitions", '-'));
        ctx.blankLine();
        for (AstNode decl : globals) {
            decl.accept(this, ctx);
        }
    }

    @Override
    public String visitFunctionDecl(FunctionDecl node, TranslationContext ctx) {
        // 原型不单独成节
        if (!node.isDefinition()) {
            return null;
        }
        String header = "Function: " + node.getName();
        ctx.line(header);
        ctx.line(underline(header, '-'));

        List<Parameter> params = node.getParams();
        String returnType = node.getReturnType().displayName();
        if (params.isEmpty()) {
            ctx.line("This function accepts no parameters and returns a value of type " + returnType + ".");
        } else if (params.size() == 1) {
            Parameter param = params.get(0);
            ctx.line("This function accepts one parameter named " + quote(param.getName()) + " of type "
                    + parameterType(param) + ", and returns a value of type " + returnType + ".");
        } else {
            ctx.line("This function accepts " + params.size() + " parameters and returns a value of type "
                    + returnType + ".");
        }
        if (node.isVariadic()) {
            ctx.line("It also accepts a variable number of additional arguments.");
        }
        ctx.blankLine();

        if (params.size() > 1) {
            ctx.line("Parameters:");
            ctx.indent();
            for (Parameter param : params) {
                ctx.line(ctx.getConfig().getBullet() + " " + quote(param.getName()) + ": " + parameterType(param));
            }
            ctx.dedent();
            ctx.blankLine();
        }

        if ("main".equals(node.getName())) {
            ctx.line("This is the main entry point of the programme.");
            ctx.blankLine();
        }

        ctx.line("The function performs the following steps:");
        ctx.blankLine();

        ctx.indent();
        List<Statement> body = node.getBody().getStatements();
        for (int i = 0; i < body.size(); i++) {
            statement(body.get(i), i + 1, ctx);
        }
        ctx.dedent();
        ctx.blankLine();
        return null;
    }

    private static String parameterType(Parameter param) {
        return param.getType().displayName() + (param.isArray() ? " (array)" : "");
    }

    @Override
    public String visitStructDecl(StructDecl node, TranslationContext ctx) {
        String kind = node.isUnion() ? "Union" : "Structure";
        String name = node.getName() != null ? quote(node.getName()) : "(anonymous)";
        List<StructDecl.Field> fields = node.getFields();
        if (fields.isEmpty()) {
            sentence(kind + " " + name + " with no members.", ctx);
            return null;
        }
        ctx.line(kind + " " + name + " with " + count(fields.size(), "member", "members") + ":");
        ctx.indent();
        for (StructDecl.Field field : fields) {
            String type = field.getType().displayName();
            if (field.isArray()) {
                type += field.getArraySize().isEmpty()
                        ? " (array)"
                        : " (array of " + field.getArraySize() + ")";
            }
            ctx.line(ctx.getConfig().getBullet() + " " + quote(field.getName()) + ": " + type);
        }
        ctx.dedent();
        ctx.blankLine();
        return null;
    }

    @Override
    public String visitEnumDecl(EnumDecl node, TranslationContext ctx) {
        String name = node.getName() != null ? quote(node.getName()) : "(anonymous)";
        List<String> constants = new ArrayList<>();
        for (EnumDecl.EnumConstant constant : node.getConstants()) {
            String text = quote(constant.getName());
            if (constant.getValue() != null) {
                text += " (" + phrase(constant.getValue(), ctx) + ")";
            }
            constants.add(text);
        }
        if (constants.isEmpty()) {
            sentence("Enumeration " + name + " with no constants.", ctx);
        } else {
            sentence("Enumeration " + name + " with the constants " + joinWithAnd(constants) + ".", ctx);
        }
        return null;
    }

    @Override
    public String visitTypedefDecl(TypedefDecl node, TranslationContext ctx) {
        if (node.getDefinition() != null) {
            node.getDefinition().accept(this, ctx);
        }
        sentence("Type alias " + quote(node.getAlias()) + " for " + node.getTarget().displayName() + ".", ctx);
        return null;
    }

    // ============ 语句 ============

    @Override
    public String visitBlock(Block node, TranslationContext ctx) {
        String prefix = ctx.takeStepPrefix();
        if (prefix.isEmpty() || node.isTransparent()) {
            // 不编号的嵌套块直接展开
            for (Statement stmt : node.getStatements()) {
                statement(stmt, 0, ctx);
            }
            return null;
        }
        // 编号上下文中的独立代码块：作为一个步骤，内部重新编号
        ctx.line(prefix + "Perform the following steps in order:");
        ctx.indent();
        List<Statement> statements = node.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            statement(statements.get(i), i + 1, ctx);
        }
        ctx.dedent();
        ctx.blankLine();
        return null;
    }

    @Override
    public String visitVarDecl(VarDecl node, TranslationContext ctx) {
        String prefix = ctx.takeStepPrefix();
        String type = node.getType().displayName();
        String line;
        if (node.isArray()) {
            line = prefix + "Declare an array named " + quote(node.getName()) + " of type " + type
                    + " with " + arraySizePhrase(node, ctx);
            if (node.hasInitializer()) {
                line += ", initialised to " + phrase(node.getInitializer(), ctx);
            }
        } else if (node.hasInitializer()) {
            line = prefix + "Declare a variable named " + quote(node.getName()) + " of type " + type
                    + ", initialised to " + phrase(node.getInitializer(), ctx);
        } else {
            line = prefix + "Declare a variable named " + quote(node.getName()) + " of type " + type;
        }
        if (node.isStatic()) {
            line += ", which keeps its value between calls";
        }
        sentence(line + ".", ctx);
        return null;
    }

    private String arraySizePhrase(VarDecl node, TranslationContext ctx) {
        Expression size = node.getArraySize();
        if (size instanceof Literal && ((Literal) size).getKind() == Literal.LiteralKind.NUMBER) {
            return ((Literal) size).getText() + " elements";
        }
        if (size != null) {
            return phrase(size, ctx) + " elements";
        }
        if (node.getInitializer() instanceof InitializerList) {
            int n = ((InitializerList) node.getInitializer()).getElements().size();
            return n + " elements";
        }
        return "an unspecified number of elements";
    }

    @Override
    public String visitIfStmt(IfStmt node, TranslationContext ctx) {
        String prefix = ctx.takeStepPrefix();
        ctx.line(prefix + "If the condition \"" + phrase(node.getCondition(), ctx) + "\" is true, then:");
        nestedBody(node.getThenBranch(), ctx);
        if (node.getElseBranch() != null) {
            ctx.line("Otherwise:");
            nestedBody(node.getElseBranch(), ctx);
        }
        ctx.blankLine();
        return null;
    }

    @Override
    public String visitWhileStmt(WhileStmt node, TranslationContext ctx) {
        String prefix = ctx.takeStepPrefix();
        ctx.line(prefix + "Whilst the condition \"" + phrase(node.getCondition(), ctx)
                + "\" remains true, repeatedly perform the following:");
        loopBody(node.getBody(), ctx);
        ctx.blankLine();
        return null;
    }

    @Override
    public String visitDoWhileStmt(DoWhileStmt node, TranslationContext ctx) {
        String prefix = ctx.takeStepPrefix();
        ctx.line(prefix + "Repeatedly perform the following:");
        loopBody(node.getBody(), ctx);
        ctx.line("Continue whilst the condition \"" + phrase(node.getCondition(), ctx) + "\" remains true.");
        ctx.blankLine();
        return null;
    }

    @Override
    public String visitForStmt(ForStmt node, TranslationContext ctx) {
        String prefix = ctx.takeStepPrefix();
        ctx.line(prefix + "Beginning with " + forInitPhrase(node.getInit(), ctx)
                + ", and continuing whilst the condition \"" + phrase(node.getCondition(), ctx, "true")
                + "\" holds, repeatedly perform the following operations, and after each iteration "
                + phrase(node.getUpdate(), ctx) + ":");
        loopBody(node.getBody(), ctx);
        ctx.blankLine();
        return null;
    }

    private void loopBody(Statement body, TranslationContext ctx) {
        ctx.enter(TranslationContext.Breakable.LOOP);
        try {
            nestedBody(body, ctx);
        } finally {
            ctx.exit();
        }
    }

    private String forInitPhrase(Statement init, TranslationContext ctx) {
        if (init == null) {
            return "nothing";
        }
        if (init instanceof ExpressionStmt) {
            return phrase(((ExpressionStmt) init).getExpression(), ctx);
        }
        if (init instanceof VarDecl) {
            return declarationPhrase((VarDecl) init, ctx);
        }
        if (init instanceof Block) {
            List<String> parts = new ArrayList<>();
            for (Statement stmt : ((Block) init).getStatements()) {
                parts.add(forInitPhrase(stmt, ctx));
            }
            return String.join(" and ", parts);
        }
        return "an expression";
    }

    private String declarationPhrase(VarDecl decl, TranslationContext ctx) {
        String text = "a variable named " + quote(decl.getName()) + " of type " + decl.getType().displayName();
        if (decl.hasInitializer()) {
            text += " initialised to " + phrase(decl.getInitializer(), ctx);
        }
        return text;
    }

    @Override
    public String visitSwitchStmt(SwitchStmt node, TranslationContext ctx) {
        String prefix = ctx.takeStepPrefix();
        ctx.line(prefix + "Depending on the value of " + phrase(node.getSubject(), ctx) + ":");
        ctx.enter(TranslationContext.Breakable.SWITCH);
        ctx.indent();
        try {
            List<String> pending = new ArrayList<>();
            List<CaseClause> clauses = node.getClauses();
            for (int i = 0; i < clauses.size(); i++) {
                CaseClause clause = clauses.get(i);
                boolean last = i == clauses.size() - 1;
                // 连续的空 case 合并到下一个 case 的标题中
                if (!clause.isDefault() && clause.getBody().isEmpty() && !last) {
                    pending.add(phrase(clause.getValue(), ctx));
                    continue;
                }
                if (clause.isDefault()) {
                    if (pending.isEmpty()) {
                        ctx.line("Otherwise (default):");
                    } else {
                        ctx.line("When it equals " + joinWithOr(pending) + ", or otherwise (default):");
                    }
                } else {
                    pending.add(phrase(clause.getValue(), ctx));
                    ctx.line("When it equals " + joinWithOr(pending) + ":");
                }
                pending.clear();
                clause.accept(this, ctx);
            }
        } finally {
            ctx.dedent();
            ctx.exit();
        }
        ctx.blankLine();
        return null;
    }

    @Override
    public String visitCaseClause(CaseClause node, TranslationContext ctx) {
        ctx.indent();
        for (Statement stmt : node.getBody()) {
            statement(stmt, 0, ctx);
        }
        ctx.dedent();
        return null;
    }

    @Override
    public String visitReturnStmt(ReturnStmt node, TranslationContext ctx) {
        String prefix = ctx.takeStepPrefix();
        if (node.hasValue()) {
            sentence(prefix + "Return " + phrase(node.getValue(), ctx) + ".", ctx);
        } else {
            sentence(prefix + "Return (void).", ctx);
        }
        return null;
    }

    @Override
    public String visitBreakStmt(BreakStmt node, TranslationContext ctx) {
        ctx.takeStepPrefix();
        if (ctx.innermostBreakable() == TranslationContext.Breakable.SWITCH) {
            sentence("Exit the switch statement.", ctx);
        } else {
            sentence("Exit the loop immediately.", ctx);
        }
        return null;
    }

    @Override
    public String visitContinueStmt(ContinueStmt node, TranslationContext ctx) {
        ctx.takeStepPrefix();
        sentence("Skip to the next iteration of the loop.", ctx);
        return null;
    }

    @Override
    public String visitGotoStmt(GotoStmt node, TranslationContext ctx) {
        sentence(ctx.takeStepPrefix() + "Jump to label " + quote(node.getLabel()) + ".", ctx);
        return null;
    }

    @Override
    public String visitLabeledStmt(LabeledStmt node, TranslationContext ctx) {
        ctx.line(ctx.takeStepPrefix() + "Label " + quote(node.getLabel()) + ":");
        ctx.indent();
        statement(node.getStatement(), 0, ctx);
        ctx.dedent();
        ctx.blankLine();
        return null;
    }

    @Override
    public String visitExpressionStmt(ExpressionStmt node, TranslationContext ctx) {
        String prefix = ctx.takeStepPrefix();
        Expression expr = node.getExpression();
        String text;
        if (expr == null) {
            text = "do nothing";
        } else if (expr instanceof CallExpr) {
            text = callPhrase((CallExpr) expr, ctx);
        } else {
            text = phrase(expr, ctx);
        }
        sentence(prefix + capitalize(text) + ".", ctx);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public String visitBinaryExpr(BinaryExpr node, TranslationContext ctx) {
        String l = phrase(node.getLeft(), ctx);
        String r = phrase(node.getRight(), ctx);
        switch (node.getOperator()) {
            case ADD:     return "the sum of " + l + " and " + r;
            case SUB:     return "the difference between " + l + " and " + r;
            case MUL:     return "the product of " + l + " and " + r;
            case DIV:     return l + " divided by " + r;
            case MOD:     return "the remainder when " + l + " is divided by " + r;
            case EQ:      return l + " is equal to " + r;
            case NE:      return l + " is not equal to " + r;
            case LT:      return l + " is less than " + r;
            case LE:      return l + " is less than or equal to " + r;
            case GT:      return l + " is greater than " + r;
            case GE:      return l + " is greater than or equal to " + r;
            case AND:     return "both " + l + " and " + r;
            case OR:      return "either " + l + " or " + r;
            case BIT_AND: return "the bitwise AND of " + l + " and " + r;
            case BIT_OR:  return "the bitwise OR of " + l + " and " + r;
            case BIT_XOR: return "the bitwise XOR of " + l + " and " + r;
            case SHL:     return l + " left-shifted by " + r + " bits";
            case SHR:     return l + " right-shifted by " + r + " bits";
            default:
                throw new IllegalStateException("Unknown binary operator: " + node.getOperator());
        }
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, TranslationContext ctx) {
        String operand = phrase(node.getOperand(), ctx);
        switch (node.getOperator()) {
            case NOT:        return "not " + operand;
            case NEG:        return "negative " + operand;
            case POS:        return operand;
            case PRE_INC:    return operand + " incremented by 1";
            case PRE_DEC:    return operand + " decremented by 1";
            case POST_INC:   return "increment " + operand + " by 1";
            case POST_DEC:   return "decrement " + operand + " by 1";
            case BIT_NOT:    return "the bitwise complement of " + operand;
            case ADDRESS_OF: return "the address of " + operand;
            case DEREF:      return "the value stored at the memory location referenced by " + operand;
            default:
                throw new IllegalStateException("Unknown unary operator: " + node.getOperator());
        }
    }

    /**
     * 作为值使用的调用
     */
    @Override
    public String visitCallExpr(CallExpr node, TranslationContext ctx) {
        String name = node.getCallee();
        if (StandardLibrary.isKnownFunction(name)) {
            return "the result of calling " + quote(name) + " to " + libraryPhrase(node, ctx);
        }
        return "the result of calling the " + quote(name) + " function" + argumentsPhrase(node, ctx);
    }

    /**
     * 作为语句的调用，祈使句形式
     */
    private String callPhrase(CallExpr node, TranslationContext ctx) {
        String name = node.getCallee();
        if (StandardLibrary.isKnownFunction(name)) {
            return libraryPhrase(node, ctx);
        }
        return "call the " + quote(name) + " function" + argumentsPhrase(node, ctx);
    }

    private String argumentsPhrase(CallExpr node, TranslationContext ctx) {
        if (node.getArgs().isEmpty()) {
            return "";
        }
        List<String> args = new ArrayList<>();
        for (Expression arg : node.getArgs()) {
            args.add(phrase(arg, ctx));
        }
        return " with arguments " + String.join(", ", args);
    }

    private String libraryPhrase(CallExpr node, TranslationContext ctx) {
        String name = node.getCallee();
        List<Expression> args = node.getArgs();
        if ("printf".equals(name)) {
            if (args.isEmpty()) {
                return "display output to the user";
            }
            Expression format = args.get(0);
            if (format instanceof Literal && ((Literal) format).getKind() == Literal.LiteralKind.STRING) {
                return "display the message " + ((Literal) format).getText();
            }
            return "display formatted output to the user";
        }
        if ("strlen".equals(name)) {
            if (args.isEmpty()) {
                return "determine the length of a text string";
            }
            return "determine the length of the text stored in " + phrase(args.get(0), ctx);
        }
        return StandardLibrary.describe(name);
    }

    @Override
    public String visitIndexExpr(IndexExpr node, TranslationContext ctx) {
        String index = phrase(node.getIndex(), ctx);
        String target = phrase(node.getTarget(), ctx);
        if (node.getTarget() instanceof Identifier) {
            return "the element at position " + index + " in the array " + target;
        }
        return "the element at position " + index + " in " + target;
    }

    @Override
    public String visitAssignExpr(AssignExpr node, TranslationContext ctx) {
        String target = phrase(node.getTarget(), ctx);
        String value = phrase(node.getValue(), ctx);
        switch (node.getOperator()) {
            case ASSIGN:     return "set " + target + " to " + value;
            case ADD_ASSIGN: return "increase " + target + " by " + value;
            case SUB_ASSIGN: return "decrease " + target + " by " + value;
            case MUL_ASSIGN: return "multiply " + target + " by " + value;
            case DIV_ASSIGN: return "divide " + target + " by " + value;
            case MOD_ASSIGN: return "set " + target + " to the remainder when divided by " + value;
            case AND_ASSIGN: return "bitwise AND " + target + " with " + value;
            case OR_ASSIGN:  return "bitwise OR " + target + " with " + value;
            case XOR_ASSIGN: return "bitwise XOR " + target + " with " + value;
            case SHL_ASSIGN: return "left-shift " + target + " by " + value + " bits";
            case SHR_ASSIGN: return "right-shift " + target + " by " + value + " bits";
            default:
                throw new IllegalStateException("Unknown assignment operator: " + node.getOperator());
        }
    }

    @Override
    public String visitLiteral(Literal node, TranslationContext ctx) {
        switch (node.getKind()) {
            case NUMBER: return "the value " + node.getText();
            case CHAR:   return "the character " + node.getText();
            default:     return node.getText();
        }
    }

    @Override
    public String visitIdentifier(Identifier node, TranslationContext ctx) {
        return quote(node.getName());
    }

    @Override
    public String visitMemberExpr(MemberExpr node, TranslationContext ctx) {
        String target = phrase(node.getTarget(), ctx);
        if (node.isArrow()) {
            return "the " + quote(node.getMember()) + " member of the structure pointed to by " + target;
        }
        return "the " + quote(node.getMember()) + " member of " + target;
    }

    @Override
    public String visitConditionalExpr(ConditionalExpr node, TranslationContext ctx) {
        return "if " + phrase(node.getCondition(), ctx) + " then " + phrase(node.getThenExpr(), ctx)
                + ", otherwise " + phrase(node.getElseExpr(), ctx);
    }

    @Override
    public String visitSizeofExpr(SizeofExpr node, TranslationContext ctx) {
        if (node.isTypeOperand()) {
            return "the size in bytes of type " + quote(node.getTargetType().displayName());
        }
        return "the size in bytes of " + phrase(node.getOperand(), ctx);
    }

    @Override
    public String visitCastExpr(CastExpr node, TranslationContext ctx) {
        TypeRef type = node.getTargetType();
        return phrase(node.getOperand(), ctx) + " converted to type " + quote(type.displayName());
    }

    @Override
    public String visitInitializerList(InitializerList node, TranslationContext ctx) {
        if (node.getElements().isEmpty()) {
            return "an empty list";
        }
        List<String> items = new ArrayList<>();
        for (Expression element : node.getElements()) {
            items.add(phrase(element, ctx));
        }
        return "a list containing " + joinWithAnd(items);
    }
}
