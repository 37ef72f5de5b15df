@NamedInterface("api")
package app.ttable.core.reference.api;

import org.springframework.modulith.NamedInterface;
