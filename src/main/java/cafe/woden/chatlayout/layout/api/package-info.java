@NamedInterface("api")
package cafe.woden.chatlayout.layout.api;

import org.springframework.modulith.NamedInterface;
