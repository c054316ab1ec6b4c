// This file is part of the RegionDecomp Library (rdl).
//
// The RegionDecomp Library is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The RegionDecomp Library is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the RegionDecomp Library. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package regiondecomp.util;

/**
 * This exception is thrown when a decomposition cannot be started because the
 * request itself is malformed. For example, the target function does not exist,
 * has not been admitted, or a term supplied by the caller is ill-typed. Such
 * errors are always raised before any region is produced.
 *
 * @author David J. Pearce
 */
public class DecompositionError extends RuntimeException {
	public static final String UNKNOWN_FUNCTION = "unknown function";
	public static final String UNKNOWN_VARIANT = "unknown variant";
	public static final String UNKNOWN_CONSTRUCTOR = "unknown constructor";
	public static final String UNKNOWN_VARIABLE = "unknown variable";
	public static final String NOT_ADMITTED = "function not admitted";
	public static final String EXPECTED_TYPE = "incompatible type";
	public static final String EXPECTED_VARIANT = "expected variant type";
	public static final String INVALID_ARGUMENT_COUNT = "invalid number of arguments";
	public static final String INVALID_FIELD_INDEX = "invalid field index";
	public static final String INVALID_PATTERN = "invalid pattern";
	public static final String INVALID_SIDE_CONDITION = "invalid side condition";
	public static final String MISSING_ARGUMENT = "missing argument";
	public static final String RESERVED_NAME = "reserved name";

	private final String msg;
	private final Object element;

	/**
	 * Identify an error with a given message.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param element
	 *            The offending element (e.g. function name or term), or
	 *            <code>null</code> if none.
	 */
	public DecompositionError(String msg, Object element) {
		this.msg = msg;
		this.element = element;
	}

	@Override
	public String getMessage() {
		if (element != null) {
			return msg + " (" + element + ")";
		} else {
			return msg;
		}
	}

	/**
	 * Error message
	 *
	 * @return
	 */
	public String msg() {
		return msg;
	}

	/**
	 * The element (e.g. name or term) that caused this error.
	 *
	 * @return
	 */
	public Object element() {
		return element;
	}

	public static final long serialVersionUID = 1l;

	/**
	 * Thrown when a function is referenced which is not declared in the registry.
	 */
	public static class UnknownFunction extends DecompositionError {
		public UnknownFunction(String name) {
			super(UNKNOWN_FUNCTION, name);
		}

		public static final long serialVersionUID = 1l;
	}

	/**
	 * Thrown when the target function (or something it depends upon) has not
	 * been established as terminating.
	 */
	public static class NotAdmitted extends DecompositionError {
		public NotAdmitted(String name) {
			super(NOT_ADMITTED, name);
		}

		public static final long serialVersionUID = 1l;
	}

	/**
	 * Thrown when a term or declaration is ill-typed.
	 */
	public static class TypeMismatch extends DecompositionError {
		public TypeMismatch(String msg, Object element) {
			super(msg, element);
		}

		public static final long serialVersionUID = 1l;
	}
}
