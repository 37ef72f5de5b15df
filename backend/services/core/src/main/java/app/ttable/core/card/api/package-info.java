@NamedInterface("api")
package app.ttable.core.card.api;

import org.springframework.modulith.NamedInterface;
