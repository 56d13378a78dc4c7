package cafe.woden.chatlayout.layout;

import cafe.woden.chatlayout.model.LinkItem;
import cafe.woden.chatlayout.model.Message;
import cafe.woden.chatlayout.model.MessageKind;
import cafe.woden.chatlayout.model.StyledText;
import java.awt.Font;

/**
 * Text followed by a preview card: a square thumbnail with title, teaser and domain stacked beside
 * it. The container always takes the full width budget.
 */
public class LinkPreviewContainerSizer implements ContainerSizer {

  public static final int IMAGE_SIZE = 60;
  public static final int IMAGE_MARGIN = 8;

  @Override
  public Size containerSize(Message message, MessageSizing sizing) {
    LinkItem link = linkOf(message);
    Font body = sizing.styles().messageLabelFont();
    Size text = TextContainerSizer.labelContainerSize(TextContainerSizer.styledTextOf(message, body), sizing);

    EdgeInsets insets = sizing.config().messageLabelInsets();
    int width = Math.max(text.width(), sizing.containerMaxWidth());
    int previewMaxWidth = width - (IMAGE_SIZE + IMAGE_MARGIN + insets.horizontal());

    LinkPreviewFonts fonts = sizing.styles().linkPreviewFonts();
    int height = text.height();
    height += measuredHeight(link.title(), fonts.titleFont(), previewMaxWidth, sizing);
    height += measuredHeight(link.teaser(), fonts.teaserFont(), previewMaxWidth, sizing);
    height += measuredHeight(link.domain(), fonts.domainFont(), previewMaxWidth, sizing);

    int minHeight = text.height() + IMAGE_SIZE;
    return new Size(width, Math.max(minHeight, height) + insets.vertical());
  }

  @Override
  public void decorate(Message message, MessageSizing sizing, LayoutAttributes.Builder attrs) {
    attrs.messageLabelInsets(sizing.config().messageLabelInsets());
    attrs.messageLabelFont(TextContainerSizer.labelFontOf(message, sizing.styles().messageLabelFont()));
    attrs.linkPreviewFonts(sizing.styles().linkPreviewFonts());
  }

  private static int measuredHeight(String s, Font font, int maxWidth, MessageSizing sizing) {
    if (s == null || s.isEmpty()) return 0;
    return sizing.measurer().measure(StyledText.plain(s, font), maxWidth).height();
  }

  private static LinkItem linkOf(Message message) {
    if (message.kind() instanceof MessageKind.LinkPreview lp) return lp.link();
    throw new LayoutPreconditionException(
        LayoutPreconditionException.Missing.SIZE_CALCULATOR,
        "link preview container cannot size message kind " + message.kind().type());
  }
}
