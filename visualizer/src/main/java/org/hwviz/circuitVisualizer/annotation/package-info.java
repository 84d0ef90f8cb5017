@ParametersAreNonnullByDefault
@FieldsAreNonnullByDefault
@MethodsAreNonnullByDefault
package org.hwviz.circuitVisualizer.annotation;

import org.hwviz.util.FieldsAreNonnullByDefault;
import org.hwviz.util.MethodsAreNonnullByDefault;

import javax.annotation.ParametersAreNonnullByDefault;
