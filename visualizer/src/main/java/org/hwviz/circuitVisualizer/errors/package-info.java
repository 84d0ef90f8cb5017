@ParametersAreNonnullByDefault
@FieldsAreNonnullByDefault
@MethodsAreNonnullByDefault
package org.hwviz.circuitVisualizer.errors;

import org.hwviz.util.FieldsAreNonnullByDefault;
import org.hwviz.util.MethodsAreNonnullByDefault;

import javax.annotation.ParametersAreNonnullByDefault;
