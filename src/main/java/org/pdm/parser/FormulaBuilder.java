package org.pdm.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.pdm.antlr.PropositionalFormulaBaseVisitor;
import org.pdm.antlr.PropositionalFormulaParser.AndExprContext;
import org.pdm.antlr.PropositionalFormulaParser.AtomContext;
import org.pdm.antlr.PropositionalFormulaParser.FormulaContext;
import org.pdm.antlr.PropositionalFormulaParser.GroupContext;
import org.pdm.antlr.PropositionalFormulaParser.IffContext;
import org.pdm.antlr.PropositionalFormulaParser.ImplicationContext;
import org.pdm.antlr.PropositionalFormulaParser.NegationContext;
import org.pdm.antlr.PropositionalFormulaParser.OrExprContext;
import org.pdm.antlr.PropositionalFormulaParser.PlainContext;
import org.pdm.antlr.PropositionalFormulaParser.XorExprContext;
import org.pdm.formula.Formula;

import java.util.List;

/**
 * Visitor che converte l'albero di parsing ANTLR nell'albero {@link Formula}.
 *
 * Ogni livello di precedenza produce una lista di operandi che viene ripiegata
 * a sinistra: A -> B -> C diventa Implies(Implies(A, B), C).
 */
class FormulaBuilder extends PropositionalFormulaBaseVisitor<Formula> {

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.iff());
    }

    @Override
    public Formula visitIff(IffContext ctx) {
        return foldLeft(Formula.Type.IFF, ctx.implication());
    }

    @Override
    public Formula visitImplication(ImplicationContext ctx) {
        return foldLeft(Formula.Type.IMPLIES, ctx.xorExpr());
    }

    @Override
    public Formula visitXorExpr(XorExprContext ctx) {
        return foldLeft(Formula.Type.XOR, ctx.orExpr());
    }

    @Override
    public Formula visitOrExpr(OrExprContext ctx) {
        return foldLeft(Formula.Type.OR, ctx.andExpr());
    }

    @Override
    public Formula visitAndExpr(AndExprContext ctx) {
        return foldLeft(Formula.Type.AND, ctx.notExpr());
    }

    @Override
    public Formula visitNegation(NegationContext ctx) {
        return Formula.not(visit(ctx.notExpr()));
    }

    @Override
    public Formula visitPlain(PlainContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Formula visitAtom(AtomContext ctx) {
        String name = ctx.ATOM().getText();
        // il lexer accetta parole che iniziano con una cifra, ma non sono identificatori validi
        if (Character.isDigit(name.charAt(0))) {
            throw new FormulaParseException(ctx.ATOM().getSymbol().getStartIndex(), "ATOM", name);
        }
        return Formula.atom(name);
    }

    @Override
    public Formula visitGroup(GroupContext ctx) {
        return visit(ctx.iff());
    }

    private Formula foldLeft(Formula.Type type, List<? extends ParserRuleContext> operands) {
        Formula result = visit(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            result = Formula.binary(type, result, visit(operands.get(i)));
        }
        return result;
    }
}
