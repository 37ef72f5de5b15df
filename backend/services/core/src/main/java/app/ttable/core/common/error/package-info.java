/**
 * Typed rejections shared by every module.
 */
@NamedInterface("error")
package app.ttable.core.common.error;

import org.springframework.modulith.NamedInterface;
