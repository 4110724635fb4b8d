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

import java.util.List;
import org.metricshub.f2cpp.UnsupportedFeatureException;
import org.metricshub.f2cpp.frontend.SourceText;
import org.metricshub.f2cpp.frontend.Statement;
import org.metricshub.f2cpp.frontend.ast.Application;
import org.metricshub.f2cpp.frontend.ast.ArrayConstructor;
import org.metricshub.f2cpp.frontend.ast.Expression;
import org.metricshub.f2cpp.frontend.ast.NameReference;
import org.metricshub.f2cpp.frontend.ast.Range;
import org.metricshub.f2cpp.scope.CppKeywords;
import org.metricshub.f2cpp.scope.ProcedureSignature;
import org.metricshub.f2cpp.scope.Symbol;

/**
 * Emits assignments, <code>allocate</code>, <code>deallocate</code> and
 * <code>call</code> statements.
 */
class AssignmentEmitter {

	private final TranslationContext context;

	AssignmentEmitter(TranslationContext context) {
		this.context = context;
	}

	void assignment(Statement statement) {
		Expression target = context.parse(statement.part(0));
		Expression value = context.parse(statement.part(1));
		if (!(target instanceof NameReference) && !(target instanceof Application)) {
			throw new UnsupportedFeatureException("Cannot assign to '" + statement.part(0) + "'");
		}
		String name = target instanceof NameReference ? ((NameReference) target).getName() : ((Application) target).getName();
		Symbol symbol = context.lookup(name);
		if (symbol != null && symbol.isConstant()) {
			throw new UnsupportedFeatureException("Assignment to constant '" + name + "'");
		}
		context.markAssigned(name);

		CppCode left = context.translate(target);
		if (left.isWholeArray()) {
			wholeArray(left.getArray(), value);
			return;
		}
		CppCode right = context.translate(value);
		if (right.isWholeArray()) {
			throw new UnsupportedFeatureException("Array value assigned to scalar '" + name + "'");
		}
		context.emit(left.getText() + " = " + right.getText() + ";");
	}

	/**
	 * Assigns a whole array from a constructor, a scalar broadcast to every
	 * element, or another array.
	 */
	private void wholeArray(Symbol array, Expression value) {
		String name = array.getTargetName();
		if (value instanceof ArrayConstructor) {
			context.emit(name + " = " + context.translate(value).getText() + ";");
			return;
		}
		CppCode right = context.translate(value);
		if (!right.isWholeArray()) {
			if (array.getShape().getRank() != 1) {
				throw new UnsupportedFeatureException("Scalar broadcast to rank " + array.getShape().getRank() + " array '" + array.getName() + "'");
			}
			if (array.getShape().isFixed()) {
				context.emit(name + ".fill(" + right.getText() + ");");
			} else {
				context.require("algorithm");
				context.emit("fill(" + name + ".begin(), " + name + ".end(), " + right.getText() + ");");
			}
			return;
		}

		Symbol source = right.getArray();
		if (source.getShape().getRank() != array.getShape().getRank()) {
			throw new UnsupportedFeatureException("Assignment between arrays of different ranks: " + array.getName() + " = " + value);
		}
		if (array.getShape().isFixed() == source.getShape().isFixed() && array.getType() == source.getType()) {
			context.emit(name + " = " + right.getText() + ";");
		} else if (array.getShape().getRank() != 1) {
			throw new UnsupportedFeatureException("Conversion between rank 2 arrays: " + array.getName() + " = " + value);
		} else if (array.getShape().isDynamic()) {
			context.emit(name + ".assign(" + right.getText() + ".begin(), " + right.getText() + ".end());");
		} else {
			context.require("algorithm");
			context.review("array '" + source.getName() + "' copied to fixed-size '" + array.getName() + "' without size check");
			context.emit("copy(" + right.getText() + ".begin(), " + right.getText() + ".end(), " + name + ".begin());");
		}
	}

	/**
	 * <code>allocate(x(n))</code> resizes a vector; the lower bound must be
	 * 1.
	 */
	void allocate(Statement statement) {
		for (Expression item : context.parseArguments(statement.part(0))) {
			if (!(item instanceof Application)) {
				throw new UnsupportedFeatureException("Unsupported allocation: " + item);
			}
			Application allocation = (Application) item;
			Symbol symbol = context.lookup(allocation.getName());
			if (symbol == null || !symbol.isAllocatable()) {
				throw new UnsupportedFeatureException("'" + allocation.getName() + "' is not an allocatable array");
			}
			List<Expression> extents = allocation.getArguments();
			if (extents.size() != symbol.getShape().getRank()) {
				throw new UnsupportedFeatureException("Allocation of '" + allocation.getName() + "' with " + extents.size() + " extent(s)");
			}
			String[] sizes = new String[extents.size()];
			for (int i = 0; i < sizes.length; i++) {
				Expression extent = extents.get(i);
				if (extent instanceof Range) {
					Range range = (Range) extent;
					Long lower = range.getLower() == null ? null : context.getFolder().fold(range.getLower());
					if (lower == null || lower.longValue() != 1 || range.getStride() != null) {
						throw new UnsupportedFeatureException("Allocation with lower bound: " + allocation);
					}
					extent = range.getUpper();
				}
				sizes[i] = context.translate(extent).getText();
			}
			context.markAssigned(allocation.getName());
			if (sizes.length == 1) {
				context.emit(symbol.getTargetName() + ".resize(" + sizes[0] + ");");
			} else {
				context.emit(symbol.getTargetName() + ".assign(" + sizes[0] + ", " + context.getTypes().row(symbol) + "(" + sizes[1] + "));");
			}
		}
	}

	void deallocate(Statement statement) {
		for (String name : SourceText.splitTopLevel(statement.part(0), ',')) {
			Symbol symbol = context.lookup(name);
			if (symbol == null || !symbol.isAllocatable()) {
				throw new UnsupportedFeatureException("'" + name + "' is not an allocatable array");
			}
			context.markAssigned(name);
			context.emit(symbol.getTargetName() + ".clear();");
		}
	}

	/**
	 * <code>call s(args)</code>, to a known subroutine or to one defined
	 * later.
	 */
	void call(Statement statement) {
		String name = statement.part(0);
		List<Expression> arguments = context.parseArguments(statement.part(1));
		ProcedureSignature procedure = context.getScopes().lookupProcedure(name);
		if (procedure != null) {
			if (procedure.isFunction()) {
				context.review("function '" + name + "' called as a subroutine");
			}
			context.emit(context.getTranslator().call(procedure, arguments) + ";");
			return;
		}
		if (IntrinsicTable.isUnsupported(name)) {
			throw new UnsupportedFeatureException("Intrinsic subroutine '" + name + "' is not supported");
		}
		if (context.lookup(name) != null) {
			throw new UnsupportedFeatureException("'" + CppKeywords.safeName(name) + "' is not a subroutine");
		}
		context.emit(context.getTranslator().unresolvedCall(name, arguments, true) + ";");
	}
}
