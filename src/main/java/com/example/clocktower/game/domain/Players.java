package com.example.clocktower.game.domain;

import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 좌석 순서대로 정렬된 플레이어 명단
 */
@RequiredArgsConstructor
public class Players {

    private final List<GamePlayer> players;

    /**
     * 플레이어 목록 전체를 좌석 순서로 반환합니다.
     */
    public List<GamePlayer> getAsList() {
        return Collections.unmodifiableList(players); // 외부에서 수정 불가
    }

    /**
     * 이름으로 특정 플레이어를 찾습니다. (대소문자 무시)
     */
    public GamePlayer findByName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        return players.stream()
                .filter(player -> player.getName().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElse(null);
    }

    /**
     * 살아있는 모든 플레이어를 반환합니다.
     */
    public List<GamePlayer> findAllAlivePlayers() {
        return players.stream()
                .filter(GamePlayer::isAlive)
                .collect(Collectors.toList());
    }

    public int countAlive() {
        return (int) players.stream().filter(GamePlayer::isAlive).count();
    }

    public long countAliveOfType(CharacterType type) {
        return players.stream()
                .filter(GamePlayer::isAlive)
                .filter(player -> player.getType() == type)
                .count();
    }

    public List<GamePlayer> findByType(CharacterType type) {
        return players.stream()
                .filter(player -> player.getType() == type)
                .collect(Collectors.toList());
    }

    /**
     * 해당 캐릭터를 실제로 가진 플레이어. 계승으로 보유자가 여럿이면 생존자가 우선이다.
     */
    public Optional<GamePlayer> findByCharacter(Character character) {
        List<GamePlayer> holders = players.stream()
                .filter(player -> player.getCharacter() == character)
                .collect(Collectors.toList());
        return holders.stream()
                .filter(GamePlayer::isAlive)
                .findFirst()
                .or(() -> holders.stream().findFirst());
    }

    /**
     * 해당 캐릭터로 깨어나는 플레이어. 실제 보유자가 없으면 그 캐릭터라고 믿는 드렁크.
     */
    public Optional<GamePlayer> findActing(Character character) {
        Optional<GamePlayer> holder = findByCharacter(character);
        if (holder.isPresent()) {
            return holder;
        }
        return players.stream()
                .filter(player -> player.getCharacter() == Character.DRUNK)
                .filter(player -> player.getDrunkCharacter() == character)
                .findFirst();
    }

    public int seatOf(GamePlayer player) {
        return players.indexOf(player);
    }

    /**
     * 지정한 플레이어부터 시작해 좌석 순서로 한 바퀴 돈 목록
     */
    public List<GamePlayer> inSeatingOrderFrom(GamePlayer start) {
        int offset = seatOf(start);
        List<GamePlayer> ordered = new ArrayList<>(players.size());
        for (int i = 0; i < players.size(); i++) {
            ordered.add(players.get((offset + i) % players.size()));
        }
        return ordered;
    }

    /**
     * 양옆의 가장 가까운 생존자. 생존자가 자신뿐이면 빈 목록.
     */
    public List<GamePlayer> aliveNeighbours(GamePlayer player) {
        int seat = seatOf(player);
        int size = players.size();
        GamePlayer left = null;
        GamePlayer right = null;
        for (int i = 1; i < size && right == null; i++) {
            GamePlayer candidate = players.get((seat + i) % size);
            if (candidate.isAlive()) {
                right = candidate;
            }
        }
        for (int i = 1; i < size && left == null; i++) {
            GamePlayer candidate = players.get(((seat - i) % size + size) % size);
            if (candidate.isAlive()) {
                left = candidate;
            }
        }
        List<GamePlayer> neighbours = new ArrayList<>(2);
        if (left != null) {
            neighbours.add(left);
        }
        if (right != null && right != left) {
            neighbours.add(right);
        }
        return neighbours;
    }

    public List<String> names() {
        return players.stream().map(GamePlayer::getName).collect(Collectors.toList());
    }

    /**
     * 플레이어 목록의 크기를 반환합니다.
     */
    public int size() {
        return players.size();
    }
}
