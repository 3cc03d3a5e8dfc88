package com.firefly.prdagent.config;

import com.firefly.prdagent.messaging.CompressionMessagingProperties;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ配置
 * 消息队列用于：群上下文压缩任务（摘要生成不阻塞对话）
 */
@Configuration
@EnableRabbit
public class RabbitMQConfig {

    @Bean
    public Queue compressionQueue(CompressionMessagingProperties properties) {
        return QueueBuilder.durable(properties.getQueue()).build();
    }

    @Bean
    public DirectExchange compressionExchange(CompressionMessagingProperties properties) {
        return new DirectExchange(properties.getExchange());
    }

    @Bean
    public Binding compressionBinding(Queue compressionQueue,
                                      DirectExchange compressionExchange,
                                      CompressionMessagingProperties properties) {
        return BindingBuilder.bind(compressionQueue)
                .to(compressionExchange)
                .with(properties.getRoutingKey());
    }

    @Bean
    public MessageConverter jacksonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory,
                                         MessageConverter messageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(messageConverter);
        return rabbitTemplate;
    }

    @Bean
    public SimpleRabbitListenerContainerFactory rabbitListenerContainerFactory(
            SimpleRabbitListenerContainerFactoryConfigurer configurer,
            ConnectionFactory connectionFactory,
            MessageConverter messageConverter) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        configurer.configure(factory, connectionFactory);
        factory.setMessageConverter(messageConverter);
        // 压缩任务失败后不无限重投，下一轮对话会重新触发
        factory.setDefaultRequeueRejected(false);
        return factory;
    }
}
