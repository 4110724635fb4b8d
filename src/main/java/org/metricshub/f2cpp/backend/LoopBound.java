package org.metricshub.f2cpp.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * F2Cpp
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.HashSet;
import java.util.Set;
import org.metricshub.f2cpp.frontend.ast.Application;
import org.metricshub.f2cpp.frontend.ast.ArrayConstructor;
import org.metricshub.f2cpp.frontend.ast.BinaryOperation;
import org.metricshub.f2cpp.frontend.ast.Expression;
import org.metricshub.f2cpp.frontend.ast.ExpressionVisitor;
import org.metricshub.f2cpp.frontend.ast.IntegerLiteral;
import org.metricshub.f2cpp.frontend.ast.KeywordArgument;
import org.metricshub.f2cpp.frontend.ast.LogicalLiteral;
import org.metricshub.f2cpp.frontend.ast.NameReference;
import org.metricshub.f2cpp.frontend.ast.Parenthesized;
import org.metricshub.f2cpp.frontend.ast.Range;
import org.metricshub.f2cpp.frontend.ast.RealLiteral;
import org.metricshub.f2cpp.frontend.ast.StringLiteral;
import org.metricshub.f2cpp.frontend.ast.UnaryOperation;
import org.metricshub.f2cpp.scope.Scope;
import org.metricshub.f2cpp.scope.ScopeStack;
import org.metricshub.f2cpp.scope.Symbol;

/**
 * The upper bound or the step of a counted loop. Fortran evaluates them once,
 * before the first iteration, while the condition of a C++ <code>for</code>
 * is evaluated at each iteration: the value must be saved in a variable when
 * the body of the loop may modify what it reads.
 */
class LoopBound implements ExpressionVisitor<Void> {

	private final ScopeStack scopes;
	private final Set<String> variables = new HashSet<String>();
	private boolean callsProcedure;

	private LoopBound(ScopeStack scopes) {
		this.scopes = scopes;
	}

	/**
	 * @param scopes the scopes of the loop statement
	 * @param expression the bound, may be {@code null}
	 * @return the variables read by the bound
	 */
	static LoopBound of(ScopeStack scopes, Expression expression) {
		LoopBound bound = new LoopBound(scopes);
		if (expression != null) {
			expression.accept(bound);
		}
		return bound;
	}

	/**
	 * @param loop the LOOP scope, once its body is translated
	 * @return whether the bound must be evaluated only once, before the loop
	 */
	boolean mustBeSaved(Scope loop) {
		if (callsProcedure) {
			return true;
		}
		for (String variable : variables) {
			if (loop.isModified(variable)) {
				return true;
			}
		}
		return false;
	}

	private Void visitAll(Iterable<Expression> expressions) {
		for (Expression expression : expressions) {
			expression.accept(this);
		}
		return null;
	}

	@Override
	public Void visitNameReference(NameReference reference) {
		variables.add(Symbol.keyOf(reference.getName()));
		return null;
	}

	@Override
	public Void visitApplication(Application application) {
		Symbol symbol = scopes.lookup(application.getName());
		if (symbol != null && symbol.isArray()) {
			variables.add(symbol.getKey());
		} else if (symbol != null || scopes.lookupProcedure(application.getName()) != null
				|| !IntrinsicTable.isMapped(application.getName())) {
			callsProcedure = true;
		}
		return visitAll(application.getArguments());
	}

	@Override
	public Void visitBinaryOperation(BinaryOperation operation) {
		operation.getLeft().accept(this);
		return operation.getRight().accept(this);
	}

	@Override
	public Void visitUnaryOperation(UnaryOperation operation) {
		return operation.getOperand().accept(this);
	}

	@Override
	public Void visitParenthesized(Parenthesized parenthesized) {
		return parenthesized.getInner().accept(this);
	}

	@Override
	public Void visitArrayConstructor(ArrayConstructor constructor) {
		return visitAll(constructor.getItems());
	}

	@Override
	public Void visitKeywordArgument(KeywordArgument argument) {
		return argument.getValue().accept(this);
	}

	@Override
	public Void visitRange(Range range) {
		for (Expression part : new Expression[] { range.getLower(), range.getUpper(), range.getStride() }) {
			if (part != null) {
				part.accept(this);
			}
		}
		return null;
	}

	@Override
	public Void visitIntegerLiteral(IntegerLiteral literal) {
		return null;
	}

	@Override
	public Void visitRealLiteral(RealLiteral literal) {
		return null;
	}

	@Override
	public Void visitStringLiteral(StringLiteral literal) {
		return null;
	}

	@Override
	public Void visitLogicalLiteral(LogicalLiteral literal) {
		return null;
	}
}
