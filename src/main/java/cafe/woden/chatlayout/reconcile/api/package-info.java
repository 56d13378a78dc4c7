@NamedInterface("api")
package cafe.woden.chatlayout.reconcile.api;

import org.springframework.modulith.NamedInterface;
