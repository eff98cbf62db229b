// Copyright 2020 The Whiley Project Developers
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
package dtlogic.util;

import dtlogic.core.LogicFile.Expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds an expression tree into a single summary value. Leaves map to {@link #BOTTOM()} unless a subclass says
 * otherwise, whilst compound expressions join the summaries of their children. Subclasses override the hooks for the
 * nodes they care about.
 *
 * @param <E> The summary produced for each expression.
 */
public abstract class AbstractExpressionFold<E> {

    public E visitExpression(Expr expr) {
        if (expr instanceof Expr.Integer || expr instanceof Expr.Boolean) {
            return BOTTOM();
        } else if (expr instanceof Expr.VariableAccess) {
            return constructVariableAccess((Expr.VariableAccess) expr);
        } else if (expr instanceof Expr.Invoke) {
            Expr.Invoke e = (Expr.Invoke) expr;
            return constructInvoke(e, visitExpressions(e.getArguments()));
        } else if (expr instanceof Expr.Apply) {
            Expr.Apply e = (Expr.Apply) expr;
            return constructApply(e, visitExpression(e.getFunction()), visitExpressions(e.getArguments()));
        } else if (expr instanceof Expr.Equals) {
            Expr.Equals e = (Expr.Equals) expr;
            return join(visitExpression(e.getLeftHandSide()), visitExpression(e.getRightHandSide()));
        } else if (expr instanceof Expr.GreaterThanOrEqual) {
            Expr.GreaterThanOrEqual e = (Expr.GreaterThanOrEqual) expr;
            return join(visitExpression(e.getLeftHandSide()), visitExpression(e.getRightHandSide()));
        } else if (expr instanceof Expr.Implies) {
            Expr.Implies e = (Expr.Implies) expr;
            return join(visitExpression(e.getLeftHandSide()), visitExpression(e.getRightHandSide()));
        } else if (expr instanceof Expr.LogicalNot) {
            return visitExpression(((Expr.LogicalNot) expr).getOperand());
        } else if (expr instanceof Expr.LogicalAnd) {
            return join(visitExpressions(((Expr.LogicalAnd) expr).getOperands()));
        } else if (expr instanceof Expr.LogicalOr) {
            return join(visitExpressions(((Expr.LogicalOr) expr).getOperands()));
        } else if (expr instanceof Expr.UniversalQuantifier) {
            return visitUniversalQuantifier((Expr.UniversalQuantifier) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<? extends Expr> exprs) {
        List<E> results = new ArrayList<>(exprs.size());
        for (Expr e : exprs) {
            results.add(visitExpression(e));
        }
        return results;
    }

    protected E visitUniversalQuantifier(Expr.UniversalQuantifier expr) {
        return visitExpression(expr.getBody());
    }

    protected E constructVariableAccess(Expr.VariableAccess expr) {
        return BOTTOM();
    }

    protected E constructInvoke(Expr.Invoke expr, List<E> arguments) {
        return join(arguments);
    }

    protected E constructApply(Expr.Apply expr, E function, List<E> arguments) {
        return join(function, join(arguments));
    }

    protected abstract E BOTTOM();

    protected abstract E join(E lhs, E rhs);

    protected E join(List<E> operands) {
        E result = BOTTOM();
        for (E operand : operands) {
            result = join(result, operand);
        }
        return result;
    }
}
