package in.matchbot.application.service;

import in.matchbot.application.port.output.ProfileRepository;
import in.matchbot.domain.conversation.OutboundMessage;
import in.matchbot.domain.like.LikeResult;
import in.matchbot.domain.profile.Profile;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the two match notices, one per side, each carrying the counterpart's
 * card and a contact link.
 */
public final class MatchNotifier {

    private final ProfileRepository profiles;

    public MatchNotifier(ProfileRepository profiles) {
        this.profiles = profiles;
    }

    /**
     * Notices for a formed match, liker first. A side whose counterpart profile
     * can no longer be read gets a notice without the card.
     */
    public List<OutboundMessage> notices(LikeResult match) {
        if (!match.isMatch()) {
            return List.of();
        }
        Optional<Profile> liker = profiles.findById(match.likerId());
        Optional<Profile> likee = profiles.findById(match.likeeId());

        List<OutboundMessage> notices = new ArrayList<>(2);
        notices.add(noticeFor(match.likerId(), match.likeeId(), likee));
        notices.add(noticeFor(match.likeeId(), match.likerId(), liker));
        return notices;
    }

    private OutboundMessage noticeFor(long recipientId, long counterpartId, Optional<Profile> counterpart) {
        if (counterpart.isEmpty()) {
            return OutboundMessage.text(recipientId, "It's a match! 🎉\n\nSay hi: " + contactLink(counterpartId, null));
        }
        Profile profile = counterpart.get();
        return OutboundMessage.card(recipientId,
            Messages.matchNotice(profile, contactLink(counterpartId, profile.username())),
            profile.photoRef(), null);
    }

    /**
     * Public handle link when the user has a username, otherwise a link by id.
     */
    public static String contactLink(long userId, String username) {
        if (username != null && !username.isBlank()) {
            return "https://t.me/" + username;
        }
        return "tg://user?id=" + userId;
    }
}
