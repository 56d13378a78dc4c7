package cafe.woden.chatlayout.layout;

/** Vertical anchor of the accessory view beside the message container. */
public enum AccessoryPosition {
  CELL_TOP,
  MESSAGE_LABEL_TOP,
  MESSAGE_TOP,
  MESSAGE_CENTER,
  MESSAGE_BOTTOM,
  CELL_BOTTOM
}
